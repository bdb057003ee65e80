package com.killradar.killfeed.http;

import com.killradar.killfeed.config.KillfeedProperties;
import java.time.Duration;
import java.util.random.RandomGenerator;

/** Exponential backoff with randomized jitter, capped per attempt and bounded by an overall budget. */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    Duration expiry,
    double jitterRatio) {

  public static RetryPolicy from(KillfeedProperties.Retry retry) {
    return new RetryPolicy(
        Math.max(1, retry.maxAttempts()),
        retry.baseDelay(),
        retry.maxDelay(),
        retry.expiry(),
        retry.jitterRatio());
  }

  /** Delay to wait after the given failed attempt (1-based). */
  public Duration delayAfter(int attempt, RandomGenerator random) {
    long baseMs = baseDelay.toMillis();
    long exponential = baseMs << Math.min(20, Math.max(0, attempt - 1));
    long capped = Math.min(exponential, maxDelay.toMillis());
    long spread = Math.round(capped * jitterRatio);
    long jitter = spread == 0 ? 0 : random.nextLong(-spread, spread + 1);
    return Duration.ofMillis(Math.max(0L, Math.min(maxDelay.toMillis(), capped + jitter)));
  }
}
