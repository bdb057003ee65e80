package com.killradar.killfeed.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/** Victim or attacker on a killmail. Ids come from upstream; names and tickers from enrichment. */
public record Participant(
    Long characterId,
    String characterName,
    Long corporationId,
    String corporationTicker,
    String corporationName,
    Long allianceId,
    String allianceTicker,
    String allianceName,
    Long shipTypeId,
    String shipName,
    Long damage,
    boolean finalBlow) {

  public static Participant fromJson(JsonNode node, String damageField) {
    return new Participant(
        JsonFields.longOrNull(node, "character_id"),
        JsonFields.textOrNull(node, "character_name"),
        JsonFields.longOrNull(node, "corporation_id"),
        JsonFields.textOrNull(node, "corporation_ticker"),
        JsonFields.textOrNull(node, "corporation_name"),
        JsonFields.longOrNull(node, "alliance_id"),
        JsonFields.textOrNull(node, "alliance_ticker"),
        JsonFields.textOrNull(node, "alliance_name"),
        JsonFields.longOrNull(node, "ship_type_id"),
        JsonFields.textOrNull(node, "ship_name"),
        JsonFields.longOrNull(node, damageField),
        node.path("final_blow").asBoolean(false));
  }

  /** Returns a copy with the given display fields filled in; null arguments keep the current value. */
  public Participant withNames(
      String characterName,
      String corporationTicker,
      String corporationName,
      String allianceTicker,
      String allianceName,
      String shipName) {
    return new Participant(
        characterId,
        characterName != null ? characterName : this.characterName,
        corporationId,
        corporationTicker != null ? corporationTicker : this.corporationTicker,
        corporationName != null ? corporationName : this.corporationName,
        allianceId,
        allianceTicker != null ? allianceTicker : this.allianceTicker,
        allianceName != null ? allianceName : this.allianceName,
        shipTypeId,
        shipName != null ? shipName : this.shipName,
        damage,
        finalBlow);
  }

  public Participant withoutNames() {
    return new Participant(
        characterId, null, corporationId, null, null, allianceId, null, null, shipTypeId, null, damage, finalBlow);
  }

  Map<String, Object> toMap(String damageField) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("character_id", characterId);
    map.put("character_name", characterName);
    map.put("corporation_id", corporationId);
    map.put("corporation_ticker", corporationTicker);
    map.put("corporation_name", corporationName);
    map.put("alliance_id", allianceId);
    map.put("alliance_ticker", allianceTicker);
    map.put("alliance_name", allianceName);
    map.put("ship_type_id", shipTypeId);
    map.put("ship_name", shipName);
    map.put(damageField, damage);
    map.put("final_blow", finalBlow);
    return map;
  }

  void putFlat(Map<String, Object> target, String prefix) {
    target.put(prefix + "char_id", characterId);
    target.put(prefix + "char_name", characterName);
    target.put(prefix + "corp_id", corporationId);
    target.put(prefix + "corp_ticker", corporationTicker);
    target.put(prefix + "corp_name", corporationName);
    target.put(prefix + "alliance_id", allianceId);
    target.put(prefix + "alliance_ticker", allianceTicker);
    target.put(prefix + "alliance_name", allianceName);
    target.put(prefix + "ship_type_id", shipTypeId);
    target.put(prefix + "ship_name", shipName);
  }
}
