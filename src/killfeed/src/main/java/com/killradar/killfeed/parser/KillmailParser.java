package com.killradar.killfeed.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.killradar.killfeed.cache.KillStore;
import com.killradar.killfeed.config.KillfeedProperties;
import com.killradar.killfeed.model.JsonFields;
import com.killradar.killfeed.model.Killmail;
import com.killradar.killfeed.model.Participant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates, normalizes, enriches and commits raw killmail records.
 *
 * <p>Stages run in order and each may stop the record: time, cutoff, build (identity and NPC
 * checks), enrichment, commit. The rolling kill count only moves for records that are new to
 * the location index and whose kill time falls inside the recent window, which is independent
 * of the caller's cutoff.
 */
@Component
public class KillmailParser {
  private static final Logger log = LoggerFactory.getLogger(KillmailParser.class);

  private final KillStore killStore;
  private final KillmailEnricher enricher;
  private final Clock clock;
  private final Duration recentWindow;
  private final Counter storedCounter;
  private final Counter olderCounter;
  private final Counter skippedCounter;

  public KillmailParser(
      KillStore killStore,
      KillmailEnricher enricher,
      KillfeedProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.killStore = killStore;
    this.enricher = enricher;
    this.clock = clock;
    this.recentWindow = properties.parser().recentWindow();
    this.storedCounter = outcomeCounter(meterRegistry, "stored");
    this.olderCounter = outcomeCounter(meterRegistry, "older");
    this.skippedCounter = outcomeCounter(meterRegistry, "skipped");
  }

  public ParseResult parse(JsonNode raw, Instant cutoff, Long contextSystemId) {
    Optional<Instant> killTime = KillmailTimes.extract(raw);
    if (killTime.isEmpty()) {
      return skipped("invalid_time", raw);
    }
    if (killTime.get().isBefore(cutoff)) {
      olderCounter.increment();
      return ParseResult.older("kill time " + killTime.get() + " before cutoff " + cutoff);
    }

    Long killmailId = killmailId(raw);
    if (killmailId == null) {
      return skipped("missing_killmail_id", raw);
    }
    Long systemId = JsonFields.longOrNull(raw, "solar_system_id");
    if (systemId == null) {
      systemId = contextSystemId;
    }
    if (systemId == null) {
      return skipped("missing_system_id", raw);
    }
    Killmail killmail = build(raw, killmailId, systemId, killTime.get());
    if (killmail.npc()) {
      return skipped("npc", raw);
    }

    Killmail enriched = enricher.enrich(killmail);
    if (!commit(enriched)) {
      return skipped("store_failed", raw);
    }
    storedCounter.increment();
    return ParseResult.stored(enriched);
  }

  public static Long killmailId(JsonNode raw) {
    Long id = JsonFields.longOrNull(raw, "killmail_id");
    return id != null ? id : JsonFields.longOrNull(raw, "killID");
  }

  public static String killmailHash(JsonNode raw) {
    String hash = JsonFields.textOrNull(raw.path("zkb"), "hash");
    if (hash == null) {
      hash = JsonFields.textOrNull(raw, "killmail_hash");
    }
    return hash != null ? hash : JsonFields.textOrNull(raw, "hash");
  }

  private Killmail build(JsonNode raw, long killmailId, long systemId, Instant killTime) {
    JsonNode zkb = raw.path("zkb");
    JsonNode victimNode = raw.path("victim");
    Participant victim = victimNode.isObject() ? Participant.fromJson(victimNode, "damage_taken") : null;

    List<Participant> attackers = new ArrayList<>();
    Participant finalBlow = null;
    for (JsonNode node : raw.path("attackers")) {
      if (!node.isObject()) {
        continue;
      }
      Participant attacker = Participant.fromJson(node, "damage_done");
      attackers.add(attacker);
      if (finalBlow == null && attacker.finalBlow()) {
        finalBlow = attacker;
      }
    }

    Long attackerCount = JsonFields.longOrNull(raw, "attacker_count");
    Double totalValue = JsonFields.doubleOrNull(zkb, "totalValue");
    if (totalValue == null) {
      totalValue = JsonFields.doubleOrNull(zkb, "total_value");
    }
    if (totalValue == null) {
      totalValue = JsonFields.doubleOrNull(raw, "total_value");
    }
    boolean npc = zkb.path("npc").asBoolean(false) || raw.path("npc").asBoolean(false);

    return new Killmail(
        killmailId,
        killmailHash(raw),
        systemId,
        killTime,
        victim,
        finalBlow,
        attackers,
        attackerCount != null ? attackerCount.intValue() : attackers.size(),
        totalValue,
        npc);
  }

  private boolean commit(Killmail killmail) {
    if (!killStore.putKillmail(killmail)) {
      return false;
    }
    boolean indexed = killStore.indexKillmail(killmail.solarSystemId(), killmail.killmailId());
    if (indexed && isRecent(killmail.killTime())) {
      killStore.incrementKillCount(killmail.solarSystemId());
    }
    return true;
  }

  private boolean isRecent(Instant killTime) {
    return !killTime.isBefore(clock.instant().minus(recentWindow));
  }

  private ParseResult skipped(String reason, JsonNode raw) {
    skippedCounter.increment();
    if (log.isDebugEnabled()) {
      log.debug("Skipping killmail {}: {}", killmailId(raw), reason);
    }
    return ParseResult.skipped(reason);
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("killfeed.parser.records.total")
        .description("Parsed killmail records (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
