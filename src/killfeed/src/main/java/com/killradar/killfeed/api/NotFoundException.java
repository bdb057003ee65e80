package com.killradar.killfeed.api;

/**
 * Requested killmail is unknown both locally and upstream.
 *
 * <p>Mapped to HTTP 404 by {@link ApiExceptionHandler}.
 */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
