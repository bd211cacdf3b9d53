package com.questrail.stabilizer.observability;

/**
 * Receives stabilization events from signals and registries.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Events are delivered on the reporting thread after the signal's own
 * lock has been released. Implementations must not block.</p>
 */
public interface StabilizerObservabilitySink {
    /**
     * Called when a signal's committed value changes.
     * @param event the transition details
     */
    void onTransition(SignalTransitionEvent event);

    /**
     * Called when a report proposes a new candidate value.
     * @param event the candidate details
     */
    void onPendingStarted(PendingTransitionEvent event);

    /**
     * Called when an in-flight candidate is dropped without being committed,
     * either because the committed value was reported again or by a reset.
     * @param event the abandoned candidate
     */
    void onPendingCancelled(PendingTransitionEvent event);

    /**
     * Called when a registry creates a signal.
     * @param event the new signal's name, value and configuration
     */
    void onSignalAdded(SignalRegistrationEvent event);

    /**
     * Called when a registry drops a signal.
     * @param event the removed signal's name, last value and configuration
     */
    void onSignalRemoved(SignalRegistrationEvent event);
}
