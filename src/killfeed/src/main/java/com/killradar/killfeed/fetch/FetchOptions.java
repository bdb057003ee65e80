package com.killradar.killfeed.fetch;

/**
 * Parameters of one paginated fetch.
 *
 * @param sinceHours age cutoff, relative to now
 * @param limit stop after this many accepted records; null fetches until the cutoff or page bound
 * @param force ignore the freshness marker
 * @param maxPages hard bound on pages requested
 */
public record FetchOptions(int sinceHours, Integer limit, boolean force, int maxPages) {

  public FetchOptions {
    if (sinceHours <= 0) {
      throw new IllegalArgumentException("sinceHours must be positive");
    }
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    if (maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive");
    }
  }

  public boolean limitReached(int accepted) {
    return limit != null && accepted >= limit;
  }
}
