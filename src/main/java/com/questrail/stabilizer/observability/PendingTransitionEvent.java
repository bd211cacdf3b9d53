package com.questrail.stabilizer.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a pending candidate that was proposed or abandoned.
 */
public record PendingTransitionEvent(
    Instant timestamp,
    String signalName,
    boolean committedValue,
    boolean candidateValue,
    int pendingCount,
    Duration pendingDuration
) {
}
