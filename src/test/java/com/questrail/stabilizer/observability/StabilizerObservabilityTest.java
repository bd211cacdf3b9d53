package com.questrail.stabilizer.observability;

import com.questrail.stabilizer.api.BufferMode;
import com.questrail.stabilizer.config.SignalConfig;
import com.questrail.stabilizer.core.SignalRegistry;
import com.questrail.stabilizer.core.StabilizedSignal;
import com.questrail.stabilizer.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StabilizerObservabilityTest
 * -----------------------------------------------------------------------------
 * Verifies which events signals and registries hand to their sink.
 */
class StabilizerObservabilityTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ManualMonotonicClock clock;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        sink = new RecordingObservabilitySink();
    }

    private StabilizedSignal signal(SignalConfig config) {
        return StabilizedSignal.builder("level")
                .withConfig(config)
                .withClock(clock)
                .withWallClock(() -> T0)
                .withObservabilitySink(sink)
                .build();
    }

    @Test
    void stabilizedCommitEmitsStartThenTransition() {
        StabilizedSignal s = signal(SignalConfig.builder().withCountThreshold(2).build());

        s.report(true);
        clock.advanceMillis(250);
        s.report(true);

        assertEquals(1, sink.getStarts().size());
        PendingTransitionEvent start = sink.getStarts().get(0);
        assertEquals("level", start.signalName());
        assertFalse(start.committedValue());
        assertTrue(start.candidateValue());
        assertEquals(1, start.pendingCount());

        List<SignalTransitionEvent> transitions = sink.getTransitions();
        assertEquals(1, transitions.size());
        SignalTransitionEvent commit = transitions.get(0);
        assertEquals(T0, commit.timestamp());
        assertFalse(commit.oldValue());
        assertTrue(commit.newValue());
        assertEquals(TransitionCause.STABILIZED, commit.cause());
        assertEquals(2, commit.pendingCount());
        assertEquals(Duration.ofMillis(250), commit.pendingDuration());
    }

    @Test
    void reportingCommittedValueEmitsCancellation() {
        StabilizedSignal s = signal(SignalConfig.builder().withCountThreshold(3).build());

        s.report(true);
        s.report(true);
        s.report(false);

        assertEquals(1, sink.getCancellations().size());
        assertEquals(2, sink.getCancellations().get(0).pendingCount());
        assertTrue(sink.getTransitions().isEmpty());
    }

    @Test
    void bypassCausesAreDistinguished() {
        StabilizedSignal s = signal(SignalConfig.builder()
                .withCountThreshold(5)
                .withBufferMode(BufferMode.TRUE_TO_FALSE)
                .build());

        s.report(true);
        s.report(false, true);

        List<SignalTransitionEvent> transitions = sink.getTransitions();
        assertEquals(TransitionCause.UNBUFFERED, transitions.get(0).cause());
        assertEquals(TransitionCause.FORCED, transitions.get(1).cause());
        assertFalse(sink.hasEventOfType(PendingTransitionEvent.class));
    }

    @Test
    void resetEmitsCancellationAndResetTransition() {
        StabilizedSignal s = signal(SignalConfig.builder().withCountThreshold(5).build());

        s.report(true);
        s.reset(true);

        assertEquals(1, sink.getCancellations().size());
        assertEquals(TransitionCause.RESET, sink.getTransitions().get(0).cause());

        // Nothing pending and no value change: nothing to report.
        int before = sink.getAllEvents().size();
        s.reset();
        s.reset(true);
        assertEquals(before, sink.getAllEvents().size());
    }

    @Test
    void registryEmitsMembershipEvents() {
        SignalRegistry registry = SignalRegistry.builder()
                .withClock(clock)
                .withWallClock(() -> T0)
                .withObservabilitySink(sink)
                .build();

        registry.add("level", true);
        registry.remove("level");

        List<Object> events = sink.getAllEvents();
        assertEquals(2, events.size());
        SignalRegistrationEvent added = (SignalRegistrationEvent) events.get(0);
        assertEquals("level", added.signalName());
        assertTrue(added.value());
        assertEquals(SignalConfig.defaults(), added.config());
        assertInstanceOf(SignalRegistrationEvent.class, events.get(1));
    }

    @Test
    void slf4jSinkAcceptsEveryEventKind() {
        Slf4jStabilizerObservabilitySink slf4j = new Slf4jStabilizerObservabilitySink();
        SignalRegistry registry = SignalRegistry.builder()
                .withDefaults(SignalConfig.builder().withCountThreshold(2).build())
                .withClock(clock)
                .withObservabilitySink(slf4j)
                .build();

        registry.add("level", false);
        registry.report("level", true);
        registry.report("level", false);
        registry.report("level", true);
        registry.report("level", true);
        registry.get("level").reset(false);
        registry.remove("level");

        assertFalse(registry.contains("level"));
    }
}
