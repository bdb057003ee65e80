package com.killradar.killfeed.dispatch;

import com.killradar.killfeed.model.Killmail;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Event delivered to consumers watching {@code systemId}. */
public record KillEvent(Type type, long systemId, List<Killmail> killmails, Long count, Instant emittedAt) {

  public enum Type {
    KILLMAIL_UPDATE("killmail-update"),
    KILL_COUNT_UPDATE("kill-count-update"),
    PRELOAD("preload");

    private final String eventName;

    Type(String eventName) {
      this.eventName = eventName;
    }

    public String eventName() {
      return eventName;
    }
  }

  public KillEvent {
    killmails = killmails == null ? List.of() : List.copyOf(killmails);
  }

  public static KillEvent killmails(long systemId, List<Killmail> killmails, Instant now) {
    return new KillEvent(Type.KILLMAIL_UPDATE, systemId, killmails, null, now);
  }

  public static KillEvent preload(long systemId, List<Killmail> killmails, Instant now) {
    return new KillEvent(Type.PRELOAD, systemId, killmails, null, now);
  }

  public static KillEvent count(long systemId, long count, Instant now) {
    return new KillEvent(Type.KILL_COUNT_UPDATE, systemId, List.of(), count, now);
  }

  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", type.eventName());
    payload.put("system_id", systemId);
    if (type == Type.KILL_COUNT_UPDATE) {
      payload.put("count", count);
    } else {
      List<Map<String, Object>> items = new ArrayList<>(killmails.size());
      for (Killmail killmail : killmails) {
        items.add(killmail.toPayload());
      }
      payload.put("killmails", items);
    }
    payload.put("emitted_at", emittedAt.toString());
    return payload;
  }
}
