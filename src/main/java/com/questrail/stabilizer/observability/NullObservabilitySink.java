package com.questrail.stabilizer.observability;

/**
 * No-op implementation of StabilizerObservabilitySink.
 */
public final class NullObservabilitySink implements StabilizerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransition(SignalTransitionEvent event) {}

    @Override
    public void onPendingStarted(PendingTransitionEvent event) {}

    @Override
    public void onPendingCancelled(PendingTransitionEvent event) {}

    @Override
    public void onSignalAdded(SignalRegistrationEvent event) {}

    @Override
    public void onSignalRemoved(SignalRegistrationEvent event) {}
}
