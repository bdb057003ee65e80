package com.killradar.killfeed.stream;

import com.killradar.killfeed.config.StreamProperties;
import java.time.Duration;
import java.util.List;

/**
 * Two-tier reconnect schedule: a short escalation indexed by the retry count, then one long
 * cooldown after which the escalation starts over in a new cycle.
 */
public final class ReconnectPolicy {

  /** Delay before the next attempt and the counters to carry into it. */
  public record Backoff(Duration delay, int retryCount, int cycleCount) {}

  private final List<Duration> retryDelays;
  private final Duration cycleDelay;

  public ReconnectPolicy(List<Duration> retryDelays, Duration cycleDelay) {
    this.retryDelays = List.copyOf(retryDelays);
    this.cycleDelay = cycleDelay;
  }

  public static ReconnectPolicy from(StreamProperties properties) {
    return new ReconnectPolicy(properties.retryDelays(), properties.cycleDelay());
  }

  public Backoff next(int retryCount, int cycleCount) {
    if (retryCount < retryDelays.size()) {
      return new Backoff(retryDelays.get(retryCount), retryCount + 1, cycleCount);
    }
    return new Backoff(cycleDelay, 0, cycleCount + 1);
  }
}
