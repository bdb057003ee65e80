package com.killradar.killfeed.http;

import java.util.function.Function;

/**
 * Final result of a retried call: either a value or the last failure reason.
 *
 * @param <T> success value type
 */
public record RetryOutcome<T>(boolean success, T value, String error, int attempts) {

  public static final String NOT_FOUND = "not_found";

  public static <T> RetryOutcome<T> success(T value, int attempts) {
    return new RetryOutcome<>(true, value, null, attempts);
  }

  public static <T> RetryOutcome<T> failure(String error, int attempts) {
    return new RetryOutcome<>(false, null, error, attempts);
  }

  public boolean notFound() {
    return !success && NOT_FOUND.equals(error);
  }

  public <R> RetryOutcome<R> map(Function<T, R> mapper) {
    return success ? new RetryOutcome<>(true, mapper.apply(value), null, attempts) : failure(error, attempts);
  }
}
