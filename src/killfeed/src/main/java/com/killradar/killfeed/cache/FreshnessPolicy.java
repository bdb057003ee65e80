package com.killradar.killfeed.cache;

import com.killradar.killfeed.config.KillfeedProperties;
import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Computes freshness windows of {@code base ± ratio·base}, never shorter than the minimum, so
 * that locations fetched together do not all go stale together.
 */
public class FreshnessPolicy {
  private final Duration base;
  private final double jitterRatio;
  private final Duration minimum;
  private final RandomGenerator random;

  public FreshnessPolicy(KillfeedProperties.Cache properties, RandomGenerator random) {
    this(properties.freshnessBase(), properties.freshnessJitterRatio(), properties.freshnessMin(), random);
  }

  FreshnessPolicy(Duration base, double jitterRatio, Duration minimum, RandomGenerator random) {
    this.base = base;
    this.jitterRatio = Math.max(0.0, jitterRatio);
    this.minimum = minimum;
    this.random = random;
  }

  public Duration nextWindow() {
    long baseMs = base.toMillis();
    long maxJitterMs = Math.round(baseMs * jitterRatio);
    long jitterMs = maxJitterMs == 0 ? 0 : random.nextLong(-maxJitterMs, maxJitterMs + 1);
    return Duration.ofMillis(Math.max(minimum.toMillis(), baseMs + jitterMs));
  }

  public Duration maxWindow() {
    long baseMs = base.toMillis();
    return Duration.ofMillis(Math.max(minimum.toMillis(), baseMs + Math.round(baseMs * jitterRatio)));
  }
}
