package com.killradar.killfeed.dispatch;

import java.util.Set;

/** Published when the set of tracked locations may have changed. */
public record TrackedSystemsChangedEvent(Set<Long> trackedSystems) {}
