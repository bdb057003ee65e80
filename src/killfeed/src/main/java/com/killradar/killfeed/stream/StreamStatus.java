package com.killradar.killfeed.stream;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/** Point-in-time view of the stream connection. */
public record StreamStatus(
    ConnectionState state,
    int retryCount,
    int cycleCount,
    String lastError,
    Set<Long> subscribedSystems,
    Duration nextRetryDelay,
    Instant connectedAt) {}
