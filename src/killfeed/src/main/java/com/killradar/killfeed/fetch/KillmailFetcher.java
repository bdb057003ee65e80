package com.killradar.killfeed.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.killradar.killfeed.cache.KillStore;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.http.KillsServiceClient;
import com.killradar.killfeed.http.RetryOutcome;
import com.killradar.killfeed.http.UpstreamUnavailableException;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.parser.KillmailParser;
import com.killradar.killfeed.parser.ParseResult;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Pull-based retrieval of killmails per location, shared by cold-start preloading and direct
 * queries.
 *
 * <p>Pages of one location are processed strictly in order because the upstream feed is newest
 * first: the first record older than the cutoff ends the whole location. Different locations
 * run in parallel and fail independently.
 */
@Service
public class KillmailFetcher {
  private static final Logger log = LoggerFactory.getLogger(KillmailFetcher.class);

  private final KillsServiceClient client;
  private final KillmailParser parser;
  private final KillStore killStore;
  private final KillfeedProperties.Fetcher properties;
  private final Clock clock;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  @Autowired
  public KillmailFetcher(
      KillsServiceClient client,
      KillmailParser parser,
      KillStore killStore,
      KillfeedProperties properties,
      Clock clock) {
    this(client, parser, killStore, properties, clock, newPool(properties.fetcher().concurrency()));
  }

  KillmailFetcher(
      KillsServiceClient client,
      KillmailParser parser,
      KillStore killStore,
      KillfeedProperties properties,
      Clock clock,
      Executor executor) {
    this.client = client;
    this.parser = parser;
    this.killStore = killStore;
    this.properties = properties.fetcher();
    this.clock = clock;
    this.executor = executor;
    this.ownedExecutor = executor instanceof ExecutorService ? (ExecutorService) executor : null;
  }

  public FetchOptions defaultOptions() {
    return new FetchOptions(properties.sinceHours(), null, false, properties.maxPages());
  }

  public FetchOptions options(Integer sinceHours, Integer limit, boolean force) {
    return new FetchOptions(
        sinceHours == null ? properties.sinceHours() : sinceHours, limit, force, properties.maxPages());
  }

  public SystemFetchResult fetchSystem(long systemId, FetchOptions options) {
    if (!options.force() && killStore.recentlyFetched(systemId)) {
      List<Killmail> cached = killStore.cachedKills(systemId, options.limit() == null ? 0 : options.limit());
      log.debug("System {} recently fetched, serving {} killmails from cache", systemId, cached.size());
      return SystemFetchResult.cached(systemId, cached);
    }

    Instant cutoff = clock.instant().minus(Duration.ofHours(options.sinceHours()));
    List<Killmail> accepted = new ArrayList<>();
    int pagesFetched = 0;
    for (int page = 1; page <= options.maxPages(); page++) {
      RetryOutcome<List<JsonNode>> outcome =
          client.fetchKillsPage(systemId, options.sinceHours(), properties.pageSize(), page);
      if (!outcome.success()) {
        log.warn("Fetch for system {} failed on page {}: {}", systemId, page, outcome.error());
        return SystemFetchResult.failed(systemId, outcome.error(), accepted, pagesFetched);
      }
      pagesFetched++;
      List<JsonNode> partials = outcome.value();
      boolean halted = processPage(systemId, partials, cutoff, options, accepted);
      if (halted || partials.size() < properties.pageSize()) {
        break;
      }
    }

    killStore.markFetched(systemId);
    log.info("Fetched system {}: {} killmails over {} page(s)", systemId, accepted.size(), pagesFetched);
    return SystemFetchResult.fetched(systemId, accepted, pagesFetched);
  }

  /**
   * Fetches several locations in parallel; every location gets its own result. The per-location
   * timeout runs from when that location's fetch starts, not from when it was queued.
   */
  public Map<Long, SystemFetchResult> fetchSystems(Collection<Long> systemIds, FetchOptions options) {
    Map<Long, CompletableFuture<SystemFetchResult>> futures = new LinkedHashMap<>();
    for (Long systemId : new LinkedHashSet<>(systemIds)) {
      futures.put(systemId, submit(systemId, options));
    }

    Map<Long, SystemFetchResult> results = new LinkedHashMap<>();
    futures.forEach((systemId, future) -> results.put(systemId, future.join()));
    return results;
  }

  private CompletableFuture<SystemFetchResult> submit(long systemId, FetchOptions options) {
    CompletableFuture<SystemFetchResult> future = new CompletableFuture<>();
    try {
      executor.execute(() -> {
        future.completeOnTimeout(
            SystemFetchResult.failed(systemId, "timeout", List.of(), 0),
            properties.systemTimeout().toMillis(),
            TimeUnit.MILLISECONDS);
        try {
          future.complete(fetchSystem(systemId, options));
        } catch (RuntimeException ex) {
          log.warn("Fetch for system {} raised", systemId, ex);
          future.complete(SystemFetchResult.failed(systemId, String.valueOf(ex.getMessage()), List.of(), 0));
        }
      });
    } catch (RejectedExecutionException ex) {
      log.warn("Fetch for system {} rejected: {}", systemId, ex.getMessage());
      future.complete(SystemFetchResult.failed(systemId, "rejected", List.of(), 0));
    }
    return future;
  }

  /**
   * One bulk request for many locations, limited to what the upstream already holds. Every
   * location fails together when the request fails.
   */
  public Map<Long, SystemFetchResult> fetchSystemsBulk(Collection<Long> systemIds, int sinceHours, int limit) {
    RetryOutcome<Map<Long, List<JsonNode>>> outcome = client.fetchSystemsKills(systemIds, sinceHours, limit);
    Map<Long, SystemFetchResult> results = new LinkedHashMap<>();
    if (!outcome.success()) {
      for (Long systemId : systemIds) {
        results.put(systemId, SystemFetchResult.failed(systemId, outcome.error(), List.of(), 0));
      }
      return results;
    }

    Instant cutoff = clock.instant().minus(Duration.ofHours(sinceHours));
    for (Long systemId : systemIds) {
      List<Killmail> accepted = new ArrayList<>();
      for (JsonNode raw : outcome.value().getOrDefault(systemId, List.of())) {
        if (accepted.size() >= limit) {
          break;
        }
        ParseResult result = parser.parse(raw, cutoff, systemId);
        if (result.outcome() == ParseResult.Outcome.STORED) {
          accepted.add(result.killmail());
        }
      }
      results.put(systemId, SystemFetchResult.fetched(systemId, accepted, 1));
    }
    return results;
  }

  /** Point lookup by id; the cache is consulted first. */
  public Optional<Killmail> fetchKillmail(long killmailId) {
    Optional<Killmail> cached = killStore.getKillmail(killmailId);
    if (cached.isPresent()) {
      return cached;
    }
    RetryOutcome<JsonNode> outcome = client.fetchKillmail(killmailId);
    if (outcome.notFound()) {
      return Optional.empty();
    }
    if (!outcome.success()) {
      throw new UpstreamUnavailableException("killmail " + killmailId + ": " + outcome.error());
    }
    ParseResult result = parser.parse(outcome.value(), Instant.EPOCH, null);
    return Optional.ofNullable(result.killmail());
  }

  /**
   * Cached killmails for a location, newest first. When nothing is indexed locally and the
   * location is not fresh, the upstream's cached set is pulled in first.
   */
  public List<Killmail> cachedKills(long systemId, int limit) {
    List<Killmail> local = killStore.cachedKills(systemId, limit);
    if (!local.isEmpty() || killStore.recentlyFetched(systemId)) {
      return local;
    }
    RetryOutcome<List<JsonNode>> outcome = client.fetchCachedKills(systemId);
    if (!outcome.success()) {
      log.warn("Upstream cached kills for system {} unavailable: {}", systemId, outcome.error());
      return local;
    }
    Instant cutoff = clock.instant().minus(Duration.ofHours(properties.sinceHours()));
    for (JsonNode raw : outcome.value()) {
      parser.parse(raw, cutoff, systemId);
    }
    return killStore.cachedKills(systemId, limit);
  }

  /** Rolling count plus the last count reported by upstream, fetched when none was pushed. */
  public KillCount killCount(long systemId) {
    long rolling = killStore.killCount(systemId);
    OptionalLong reported = killStore.reportedCount(systemId);
    if (reported.isPresent()) {
      return new KillCount(systemId, rolling, reported.getAsLong());
    }
    RetryOutcome<Long> outcome = client.fetchKillCount(systemId);
    if (!outcome.success()) {
      log.debug("Upstream kill count for system {} unavailable: {}", systemId, outcome.error());
      return new KillCount(systemId, rolling, null);
    }
    killStore.storeReportedCount(systemId, outcome.value());
    return new KillCount(systemId, rolling, outcome.value());
  }

  public record KillCount(long systemId, long rolling, Long reported) {}

  private boolean processPage(
      long systemId, List<JsonNode> partials, Instant cutoff, FetchOptions options, List<Killmail> accepted) {
    for (JsonNode partial : partials) {
      Long killmailId = KillmailParser.killmailId(partial);

      if (killmailId != null) {
        Optional<Killmail> cached = killStore.getKillmail(killmailId);
        if (cached.isPresent()) {
          if (cached.get().killTime().isBefore(cutoff)) {
            return true;
          }
          accepted.add(cached.get());
          if (options.limitReached(accepted.size())) {
            return true;
          }
          continue;
        }
      }

      ParseResult result;
      if (killmailId != null && KillmailParser.killmailHash(partial) != null) {
        RetryOutcome<JsonNode> full = client.fetchKillmail(killmailId);
        if (!full.success()) {
          log.warn("Skipping killmail {} in system {}: {}", killmailId, systemId, full.error());
          continue;
        }
        result = parser.parse(withMetadata(full.value(), partial), cutoff, systemId);
      } else {
        result = parser.parse(partial, cutoff, systemId);
      }

      if (result.outcome() == ParseResult.Outcome.OLDER) {
        return true;
      }
      if (result.outcome() == ParseResult.Outcome.STORED) {
        accepted.add(result.killmail());
        if (options.limitReached(accepted.size())) {
          return true;
        }
      }
    }
    return false;
  }

  // The partial carries zkb metadata (hash, value, npc flag) that the full record may lack.
  private static JsonNode withMetadata(JsonNode full, JsonNode partial) {
    if (!full.isObject() || !partial.has("zkb")) {
      return full;
    }
    ObjectNode merged = ((ObjectNode) full).deepCopy();
    if (!merged.has("zkb")) {
      merged.set("zkb", partial.get("zkb"));
    }
    return merged;
  }

  @PreDestroy
  public void stop() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
    }
  }

  private static ExecutorService newPool(int concurrency) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(Math.max(1, concurrency), runnable -> {
      Thread thread = new Thread(runnable, "killfeed-fetch-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }
}
