package com.killradar.killfeed.subscription;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/** Minimal change between a desired and a live subscription set. */
public record SubscriptionDiff(Set<Long> toAdd, Set<Long> toRemove) {

  public SubscriptionDiff {
    toAdd = Set.copyOf(toAdd);
    toRemove = Set.copyOf(toRemove);
  }

  public static SubscriptionDiff between(Collection<Long> desired, Collection<Long> live) {
    return new SubscriptionDiff(additions(desired, live), additions(live, desired));
  }

  /** Requested ids that are not live yet. */
  public static Set<Long> additions(Collection<Long> requested, Collection<Long> live) {
    Set<Long> result = new TreeSet<>(requested);
    result.removeAll(live);
    return result;
  }

  /** Requested ids that are live, and therefore worth an unsubscribe. */
  public static Set<Long> removals(Collection<Long> requested, Collection<Long> live) {
    Set<Long> result = new TreeSet<>(requested);
    result.retainAll(live);
    return result;
  }

  public boolean isEmpty() {
    return toAdd.isEmpty() && toRemove.isEmpty();
  }
}
