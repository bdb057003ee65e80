package com.killradar.killfeed.http;

/**
 * Result of a single upstream call as seen by {@link Retrier}.
 *
 * @param <T> success value type
 */
public record Attempt<T>(Kind kind, T value, String reason, boolean rateLimited) {

  public enum Kind {
    SUCCESS,
    RETRYABLE,
    TERMINAL
  }

  public static <T> Attempt<T> success(T value) {
    return new Attempt<>(Kind.SUCCESS, value, null, false);
  }

  public static <T> Attempt<T> retryable(String reason) {
    return new Attempt<>(Kind.RETRYABLE, null, reason, false);
  }

  public static <T> Attempt<T> rateLimited(String reason) {
    return new Attempt<>(Kind.RETRYABLE, null, reason, true);
  }

  public static <T> Attempt<T> terminal(String reason) {
    return new Attempt<>(Kind.TERMINAL, null, reason, false);
  }
}
