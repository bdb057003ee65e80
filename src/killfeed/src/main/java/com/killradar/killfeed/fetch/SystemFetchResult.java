package com.killradar.killfeed.fetch;

import com.killradar.killfeed.model.Killmail;
import java.util.List;

/**
 * Per-location fetch result. A failed location still reports what it accepted before failing.
 */
public record SystemFetchResult(
    long systemId,
    Status status,
    List<Killmail> killmails,
    int pagesFetched,
    String error) {

  public enum Status {
    FETCHED,
    CACHED,
    FAILED
  }

  public SystemFetchResult {
    killmails = killmails == null ? List.of() : List.copyOf(killmails);
  }

  public static SystemFetchResult fetched(long systemId, List<Killmail> killmails, int pagesFetched) {
    return new SystemFetchResult(systemId, Status.FETCHED, killmails, pagesFetched, null);
  }

  public static SystemFetchResult cached(long systemId, List<Killmail> killmails) {
    return new SystemFetchResult(systemId, Status.CACHED, killmails, 0, null);
  }

  public static SystemFetchResult failed(long systemId, String error, List<Killmail> partial, int pagesFetched) {
    return new SystemFetchResult(systemId, Status.FAILED, partial, pagesFetched, error);
  }

  public boolean ok() {
    return status != Status.FAILED;
  }
}
