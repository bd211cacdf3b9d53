package com.questrail.stabilizer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StabilizerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStabilizerObservabilitySink implements StabilizerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStabilizerObservabilitySink.class);

    @Override
    public void onTransition(SignalTransitionEvent event) {
        log.info("Signal '{}': {} -> {} ({}, count={}, pending={})",
            event.signalName(),
            event.oldValue(),
            event.newValue(),
            event.cause(),
            event.pendingCount(),
            event.pendingDuration());
    }

    @Override
    public void onPendingStarted(PendingTransitionEvent event) {
        log.debug("Signal '{}': candidate {} proposed against committed {}",
            event.signalName(),
            event.candidateValue(),
            event.committedValue());
    }

    @Override
    public void onPendingCancelled(PendingTransitionEvent event) {
        log.debug("Signal '{}': candidate {} dropped after {} report(s), {}",
            event.signalName(),
            event.candidateValue(),
            event.pendingCount(),
            event.pendingDuration());
    }

    @Override
    public void onSignalAdded(SignalRegistrationEvent event) {
        log.debug("Signal '{}' added: value={}, config={}", event.signalName(), event.value(), event.config());
    }

    @Override
    public void onSignalRemoved(SignalRegistrationEvent event) {
        log.debug("Signal '{}' removed: value={}", event.signalName(), event.value());
    }
}
