package com.questrail.stabilizer.observability;

import com.questrail.stabilizer.config.SignalConfig;

import java.time.Instant;

/**
 * Record representing a signal entering or leaving a registry.
 *
 * @param value the committed value at the time of the event
 */
public record SignalRegistrationEvent(
    Instant timestamp,
    String signalName,
    boolean value,
    SignalConfig config
) {
}
