package com.questrail.stabilizer.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a change of a signal's committed value.
 *
 * <p>{@code pendingCount} and {@code pendingDuration} describe the candidate at
 * the moment of commit; both are zero when the change bypassed stabilization
 * without a candidate in flight.</p>
 */
public record SignalTransitionEvent(
    Instant timestamp,
    String signalName,
    boolean oldValue,
    boolean newValue,
    TransitionCause cause,
    int pendingCount,
    Duration pendingDuration
) {
}
