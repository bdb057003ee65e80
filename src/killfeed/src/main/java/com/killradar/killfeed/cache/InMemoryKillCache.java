package com.killradar.killfeed.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local cache backend used when Redis is not configured and in tests.
 *
 * <p>Atomicity comes from {@link ConcurrentHashMap#compute}; expired entries read as absent and
 * are replaced on the next write.
 */
public class InMemoryKillCache extends AbstractKillCache {

  private record Entry(String value, List<String> members, long expiresAtMs) {
    boolean expired(long nowMs) {
      return nowMs >= expiresAtMs;
    }
  }

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

  public InMemoryKillCache(FreshnessPolicy freshnessPolicy, Clock clock) {
    super(freshnessPolicy, clock);
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, null, expiry(ttl)));
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = live(key);
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.value());
  }

  @Override
  public long increment(String key, long amount, long defaultValue, Duration ttl) {
    long now = clock.millis();
    Entry updated = entries.compute(key, (k, current) -> {
      long base = defaultValue;
      if (current != null && !current.expired(now) && current.value() != null) {
        base = Long.parseLong(current.value());
      }
      return new Entry(Long.toString(base + amount), null, expiry(ttl));
    });
    return Long.parseLong(updated.value());
  }

  @Override
  public boolean prependUnique(String key, String member, Duration ttl) {
    long now = clock.millis();
    AtomicBoolean added = new AtomicBoolean(false);
    entries.compute(key, (k, current) -> {
      List<String> members = current == null || current.expired(now) || current.members() == null
          ? List.of()
          : current.members();
      if (members.contains(member)) {
        return current;
      }
      List<String> next = new ArrayList<>(members.size() + 1);
      next.add(member);
      next.addAll(members);
      added.set(true);
      return new Entry(null, List.copyOf(next), expiry(ttl));
    });
    return added.get();
  }

  @Override
  public List<String> range(String key, int limit) {
    Entry entry = live(key);
    if (entry == null || entry.members() == null) {
      return List.of();
    }
    List<String> members = entry.members();
    return limit <= 0 || limit >= members.size() ? members : members.subList(0, limit);
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  private Entry live(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.expired(clock.millis())) {
      entries.remove(key, entry);
      return null;
    }
    return entry;
  }

  private long expiry(Duration ttl) {
    return clock.millis() + ttl.toMillis();
  }
}
