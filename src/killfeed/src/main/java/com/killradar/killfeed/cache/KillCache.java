package com.killradar.killfeed.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Key-addressed storage shared by the push and pull ingestion paths.
 *
 * <p>Every operation is safe under concurrent callers without an external lock. No operation
 * spans more than one key.
 */
public interface KillCache {

  /** Unconditional overwrite; the TTL is reset on every write. */
  void put(String key, String value, Duration ttl);

  /** Returns the stored value, or empty on a miss or an expired entry. */
  Optional<String> get(String key);

  /**
   * Atomically adds {@code amount}, creating the key at {@code defaultValue + amount} when absent.
   * The TTL is reapplied on every call.
   *
   * @return the value after the increment
   */
  long increment(String key, long amount, long defaultValue, Duration ttl);

  /**
   * Stores a jittered expiry instant for {@code key}.
   *
   * @return the stored expiry
   */
  Instant markFresh(String key);

  /** True while the stored expiry is in the future; an absent key is never fresh. */
  boolean isFresh(String key);

  /**
   * Prepends {@code member} to the list at {@code key} unless it is already present.
   *
   * @return true when the member was added
   */
  boolean prependUnique(String key, String member, Duration ttl);

  /** Returns up to {@code limit} members, newest first. A non-positive limit returns all. */
  List<String> range(String key, int limit);

  void delete(String key);
}
