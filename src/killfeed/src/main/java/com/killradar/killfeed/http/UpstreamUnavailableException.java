package com.killradar.killfeed.http;

/** Raised at the REST boundary when an upstream call exhausted its retries. */
public class UpstreamUnavailableException extends RuntimeException {
  public UpstreamUnavailableException(String message) {
    super(message);
  }
}
