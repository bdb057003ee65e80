package com.killradar.killfeed.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.model.Killmail;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Killmail-shaped view over {@link KillCache}: records, per-location index, rolling and reported
 * counts, freshness markers and identity lookups.
 */
@Component
public class KillStore {
  private static final Logger log = LoggerFactory.getLogger(KillStore.class);

  private final KillCache cache;
  private final ObjectMapper objectMapper;
  private final KillfeedProperties.Cache properties;
  private final CacheKeys keys;

  public KillStore(KillCache cache, ObjectMapper objectMapper, KillfeedProperties properties) {
    this.cache = cache;
    this.objectMapper = objectMapper;
    this.properties = properties.cache();
    this.keys = new CacheKeys(this.properties.keyPrefix());
  }

  /** Stores the record. Returns false when it could not be serialized and nothing was written. */
  public boolean putKillmail(Killmail killmail) {
    String json;
    try {
      json = objectMapper.writeValueAsString(killmail.toPayload());
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize killmail {}", killmail.killmailId(), ex);
      return false;
    }
    cache.put(keys.killmail(killmail.killmailId()), json, properties.killmailTtl());
    return true;
  }

  public Optional<Killmail> getKillmail(long killmailId) {
    Optional<String> json = cache.get(keys.killmail(killmailId));
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Killmail.fromPayload(objectMapper.readTree(json.get())));
    } catch (Exception ex) {
      log.warn("Discarding unreadable cached killmail {}", killmailId, ex);
      cache.delete(keys.killmail(killmailId));
      return Optional.empty();
    }
  }

  /** Adds the killmail to the location index. Returns false when it was already indexed. */
  public boolean indexKillmail(long systemId, long killmailId) {
    return cache.prependUnique(keys.systemKills(systemId), Long.toString(killmailId), properties.killmailTtl());
  }

  /** Newest-first killmails for a location; index entries whose record has expired are skipped. */
  public List<Killmail> cachedKills(long systemId, int limit) {
    List<Killmail> kills = new ArrayList<>();
    for (String member : cache.range(keys.systemKills(systemId), 0)) {
      if (limit > 0 && kills.size() >= limit) {
        break;
      }
      try {
        getKillmail(Long.parseLong(member)).ifPresent(kills::add);
      } catch (NumberFormatException ex) {
        log.debug("Ignoring malformed kill index entry {} for system {}", member, systemId);
      }
    }
    return kills;
  }

  public long incrementKillCount(long systemId) {
    return cache.increment(keys.systemKillCount(systemId), 1, 0, properties.killCountTtl());
  }

  public long killCount(long systemId) {
    return cache.get(keys.systemKillCount(systemId)).map(KillStore::parseLong).orElse(0L);
  }

  /** Count pushed by upstream; kept apart from the rolling counter, which is increment-only. */
  public void storeReportedCount(long systemId, long count) {
    cache.put(keys.systemReportedCount(systemId), Long.toString(count), properties.killCountTtl());
  }

  public OptionalLong reportedCount(long systemId) {
    Optional<String> stored = cache.get(keys.systemReportedCount(systemId));
    return stored.isEmpty() ? OptionalLong.empty() : OptionalLong.of(parseLong(stored.get()));
  }

  public Instant markFetched(long systemId) {
    return cache.markFresh(keys.systemFetched(systemId));
  }

  public boolean recentlyFetched(long systemId) {
    return cache.isFresh(keys.systemFetched(systemId));
  }

  public Optional<String> identity(String kind, long id) {
    return cache.get(keys.identity(kind, id));
  }

  public void putIdentity(String kind, long id, String json, boolean notFound) {
    Duration ttl = notFound ? properties.identityNotFoundTtl() : properties.identityTtl();
    cache.put(keys.identity(kind, id), json, ttl);
  }

  private static long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return 0L;
    }
  }
}
