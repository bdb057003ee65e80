package com.killradar.killfeed.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Freshness markers on top of plain {@code put}/{@code get}: the value is the expiry in epoch millis. */
abstract class AbstractKillCache implements KillCache {
  private final FreshnessPolicy freshnessPolicy;
  protected final Clock clock;

  protected AbstractKillCache(FreshnessPolicy freshnessPolicy, Clock clock) {
    this.freshnessPolicy = freshnessPolicy;
    this.clock = clock;
  }

  @Override
  public Instant markFresh(String key) {
    Duration window = freshnessPolicy.nextWindow();
    Instant expiresAt = clock.instant().plus(window);
    put(key, Long.toString(expiresAt.toEpochMilli()), window);
    return expiresAt;
  }

  @Override
  public boolean isFresh(String key) {
    Optional<String> stored = get(key);
    if (stored.isEmpty()) {
      return false;
    }
    try {
      return clock.millis() < Long.parseLong(stored.get().trim());
    } catch (NumberFormatException ex) {
      return false;
    }
  }
}
