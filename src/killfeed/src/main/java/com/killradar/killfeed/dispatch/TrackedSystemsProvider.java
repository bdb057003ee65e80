package com.killradar.killfeed.dispatch;

import java.util.Set;

/** Answers which locations are of interest right now. */
public interface TrackedSystemsProvider {

  Set<Long> trackedSystems();
}
