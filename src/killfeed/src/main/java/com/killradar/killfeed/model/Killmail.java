package com.killradar.killfeed.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical killmail shape shared by the stream and fetch paths.
 *
 * <p>The payload form nests {@code victim} and {@code attackers} and also duplicates the victim
 * and final-blow fields at the root ({@code victim_char_id}, {@code final_blow_corp_ticker}, ...)
 * so consumers can render a row without walking the attacker list.
 */
public record Killmail(
    long killmailId,
    String killmailHash,
    long solarSystemId,
    Instant killTime,
    Participant victim,
    Participant finalBlow,
    List<Participant> attackers,
    int attackerCount,
    Double totalValue,
    boolean npc) {

  public Killmail {
    attackers = attackers == null ? List.of() : List.copyOf(attackers);
  }

  /** Replaces the victim and the final-blow attacker, keeping the attacker list in step. */
  public Killmail withParticipants(Participant victim, Participant finalBlow) {
    List<Participant> updatedAttackers = new ArrayList<>(attackers);
    if (finalBlow != null) {
      for (int i = 0; i < updatedAttackers.size(); i++) {
        if (updatedAttackers.get(i).finalBlow()) {
          updatedAttackers.set(i, finalBlow);
          break;
        }
      }
    }
    return new Killmail(
        killmailId, killmailHash, solarSystemId, killTime, victim, finalBlow, updatedAttackers, attackerCount, totalValue, npc);
  }

  /** Same record with every enrichment field cleared; used to compare records from different paths. */
  public Killmail withoutEnrichment() {
    List<Participant> plainAttackers = new ArrayList<>(attackers.size());
    for (Participant attacker : attackers) {
      plainAttackers.add(attacker.withoutNames());
    }
    return new Killmail(
        killmailId,
        killmailHash,
        solarSystemId,
        killTime,
        victim == null ? null : victim.withoutNames(),
        finalBlow == null ? null : finalBlow.withoutNames(),
        plainAttackers,
        attackerCount,
        totalValue,
        npc);
  }

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("killmail_id", killmailId);
    payload.put("killmail_hash", killmailHash);
    payload.put("solar_system_id", solarSystemId);
    payload.put("kill_time", killTime.toString());
    (victim == null ? emptyParticipant() : victim).putFlat(payload, "victim_");
    (finalBlow == null ? emptyParticipant() : finalBlow).putFlat(payload, "final_blow_");
    payload.put("attacker_count", attackerCount);
    payload.put("total_value", totalValue);
    payload.put("npc", npc);
    payload.put("victim", victim == null ? null : victim.toMap("damage_taken"));
    List<Map<String, Object>> attackerMaps = new ArrayList<>(attackers.size());
    for (Participant attacker : attackers) {
      attackerMaps.add(attacker.toMap("damage_done"));
    }
    payload.put("attackers", attackerMaps);
    return payload;
  }

  public static Killmail fromPayload(JsonNode payload) {
    JsonNode victimNode = payload.path("victim");
    Participant victim = victimNode.isObject() ? Participant.fromJson(victimNode, "damage_taken") : null;
    List<Participant> attackers = new ArrayList<>();
    Participant finalBlow = null;
    for (JsonNode node : payload.path("attackers")) {
      Participant attacker = Participant.fromJson(node, "damage_done");
      attackers.add(attacker);
      if (finalBlow == null && attacker.finalBlow()) {
        finalBlow = attacker;
      }
    }
    JsonNode value = payload.path("total_value");
    return new Killmail(
        payload.path("killmail_id").asLong(),
        JsonFields.textOrNull(payload, "killmail_hash"),
        payload.path("solar_system_id").asLong(),
        Instant.parse(payload.path("kill_time").asText()),
        victim,
        finalBlow,
        attackers,
        payload.path("attacker_count").asInt(attackers.size()),
        value.isNumber() ? value.asDouble() : null,
        payload.path("npc").asBoolean(false));
  }

  private static Participant emptyParticipant() {
    return new Participant(null, null, null, null, null, null, null, null, null, null, null, false);
  }
}
