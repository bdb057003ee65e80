package com.killradar.killfeed.stream;

/** A subscribe or unsubscribe push was not acknowledged; the local subscription set was rolled back. */
public class PushFailedException extends RuntimeException {
  public PushFailedException(String message) {
    super(message);
  }
}
