package com.killradar.killfeed.http;

import com.killradar.killfeed.config.KillfeedProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs an upstream call under a {@link RetryPolicy}. Expected failures travel as values; an
 * unexpected runtime exception from the call counts as a retryable failure.
 */
@Component
public class Retrier {
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final RandomGenerator random;
  private final Clock clock;
  private final Sleeper sleeper;

  @Autowired
  public Retrier(KillfeedProperties properties, RandomGenerator jitterRandom, Clock clock) {
    this(RetryPolicy.from(properties.retry()), jitterRandom, clock, duration -> Thread.sleep(duration.toMillis()));
  }

  public Retrier(RetryPolicy policy, RandomGenerator random, Clock clock, Sleeper sleeper) {
    this.policy = policy;
    this.random = random;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public RetryPolicy policy() {
    return policy;
  }

  public <T> RetryOutcome<T> run(String operation, Supplier<Attempt<T>> call) {
    Instant deadline = clock.instant().plus(policy.expiry());
    String lastReason = "no attempt made";
    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      Attempt<T> result;
      try {
        result = call.get();
      } catch (RuntimeException ex) {
        result = Attempt.retryable(ex.getClass().getSimpleName() + ": " + ex.getMessage());
      }

      if (result.kind() == Attempt.Kind.SUCCESS) {
        return RetryOutcome.success(result.value(), attempt);
      }
      if (result.kind() == Attempt.Kind.TERMINAL) {
        return RetryOutcome.failure(result.reason(), attempt);
      }

      lastReason = result.reason();
      if (attempt == policy.maxAttempts()) {
        break;
      }
      Duration delay = policy.delayAfter(attempt, random);
      if (clock.instant().plus(delay).isAfter(deadline)) {
        log.warn("{} retry budget expired after {} attempts: {}", operation, attempt, lastReason);
        return RetryOutcome.failure("retry budget expired: " + lastReason, attempt);
      }
      if (result.rateLimited()) {
        log.warn("{} rate limited (attempt {}), retrying in {}ms", operation, attempt, delay.toMillis());
      } else {
        log.debug("{} failed (attempt {}): {}, retrying in {}ms", operation, attempt, lastReason, delay.toMillis());
      }
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return RetryOutcome.failure("interrupted", attempt);
      }
    }
    log.warn("{} failed after {} attempts: {}", operation, policy.maxAttempts(), lastReason);
    return RetryOutcome.failure("retries exhausted: " + lastReason, policy.maxAttempts());
  }
}
