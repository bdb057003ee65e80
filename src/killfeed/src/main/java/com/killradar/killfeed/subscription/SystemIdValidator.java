package com.killradar.killfeed.subscription;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Plausibility check for location identifiers (k-space, w-space and abyssal ranges). */
public final class SystemIdValidator {
  static final long MIN_EXCLUSIVE = 30_000_000L;
  static final long MAX_EXCLUSIVE = 33_000_000L;

  private SystemIdValidator() {
  }

  public static boolean isValid(Long systemId) {
    return systemId != null && systemId > MIN_EXCLUSIVE && systemId < MAX_EXCLUSIVE;
  }

  /**
   * Returns the batch as a sorted set when every id is valid.
   *
   * @throws InvalidSystemIdsException naming every rejected id; nothing is applied
   */
  public static Set<Long> requireValid(Collection<Long> systemIds) {
    if (systemIds == null || systemIds.isEmpty()) {
      throw new InvalidSystemIdsException(List.of(), "at least one system id is required");
    }
    Set<Long> valid = new TreeSet<>();
    List<Long> invalid = new ArrayList<>();
    for (Long systemId : systemIds) {
      if (isValid(systemId)) {
        valid.add(systemId);
      } else {
        invalid.add(systemId);
      }
    }
    if (!invalid.isEmpty()) {
      throw new InvalidSystemIdsException(invalid, "invalid system ids: " + invalid);
    }
    return valid;
  }
}
