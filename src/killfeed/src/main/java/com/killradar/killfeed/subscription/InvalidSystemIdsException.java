package com.killradar.killfeed.subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A subscription batch contained implausible location ids and was rejected as a whole. */
public class InvalidSystemIdsException extends RuntimeException {
  public static final String CODE = "invalid_identifiers";

  private final List<Long> invalidIds;

  public InvalidSystemIdsException(List<Long> invalidIds, String message) {
    super(message);
    this.invalidIds = Collections.unmodifiableList(new ArrayList<>(invalidIds));
  }

  public List<Long> invalidIds() {
    return invalidIds;
  }
}
