package com.questrail.stabilizer.core;

import com.questrail.stabilizer.api.BufferMode;
import com.questrail.stabilizer.api.DuplicateSignalException;
import com.questrail.stabilizer.api.InvalidConfigurationException;
import com.questrail.stabilizer.api.SignalNotFoundException;
import com.questrail.stabilizer.config.SignalConfig;
import com.questrail.stabilizer.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.questrail.stabilizer.api.TransitionDirection.TRUE_TO_FALSE;
import static org.junit.jupiter.api.Assertions.*;

class SignalRegistryTest {

    private ManualMonotonicClock clock;
    private SignalRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        registry = SignalRegistry.builder()
                .withDefaults(SignalConfig.builder()
                        .withCountThreshold(3)
                        .withDurationThreshold(Duration.ofSeconds(1))
                        .build())
                .withClock(clock)
                .withWallClock(() -> Instant.EPOCH)
                .build();
    }

    @Test
    void defaultRegistryStartsEmptyWithLibraryDefaults() {
        SignalRegistry plain = new SignalRegistry();

        assertEquals(0, plain.size());
        assertEquals(SignalConfig.defaults(), plain.defaults());
        assertTrue(plain.getAllValues().isEmpty());
    }

    @Test
    void addInheritsRegistryDefaults() {
        StabilizedSignal s = registry.add("motion", false);

        assertTrue(registry.contains("motion"));
        assertEquals(1, registry.size());
        assertSame(s, registry.get("motion"));
        assertEquals(registry.defaults(), s.config());
    }

    @Test
    void addOverridesOnlyNamedFields() {
        StabilizedSignal s = registry.add("motion", true, b -> b
                .withCountThreshold(1)
                .withBufferMode(BufferMode.TRUE_TO_FALSE));

        assertTrue(s.value());
        assertEquals(1, s.thresholds().countThreshold());
        assertEquals(Duration.ofSeconds(1), s.thresholds().durationThreshold());
        assertEquals(BufferMode.TRUE_TO_FALSE, s.bufferMode());
    }

    @Test
    void addRejectsDuplicateNames() {
        registry.add("motion", false);

        DuplicateSignalException ex = assertThrows(DuplicateSignalException.class,
                () -> registry.add("motion", true));
        assertEquals("motion", ex.signalName());
        assertFalse(registry.getValue("motion"));
    }

    @Test
    void addRejectsInvalidOverridesWithoutRegistering() {
        assertThrows(InvalidConfigurationException.class,
                () -> registry.add("motion", false, b -> b.withCountThreshold(0)));

        assertFalse(registry.contains("motion"));
    }

    @Test
    void unknownNamesFailEverywhere() {
        assertThrows(SignalNotFoundException.class, () -> registry.get("ghost"));
        assertThrows(SignalNotFoundException.class, () -> registry.remove("ghost"));
        assertThrows(SignalNotFoundException.class, () -> registry.report("ghost", true));
        assertThrows(SignalNotFoundException.class, () -> registry.report("ghost", true, 0L));
        assertThrows(SignalNotFoundException.class, () -> registry.report("ghost", true, 0L, true));
        assertThrows(SignalNotFoundException.class, () -> registry.getValue("ghost"));
        assertTrue(registry.find("ghost").isEmpty());
    }

    @Test
    void removeDropsTheSignal() {
        StabilizedSignal added = registry.add("motion", false);

        assertSame(added, registry.remove("motion"));
        assertFalse(registry.contains("motion"));
        assertEquals(0, registry.size());

        // The name can be reused once removed.
        registry.add("motion", true);
        assertTrue(registry.getValue("motion"));
    }

    @Test
    void reportDelegatesToNamedSignal() {
        registry.add("motion", false);
        registry.add("door", false);

        assertFalse(registry.report("motion", true));
        assertFalse(registry.report("motion", true));
        clock.advanceMillis(1000);
        assertTrue(registry.report("motion", true));

        assertFalse(registry.getValue("door"));
    }

    @Test
    void reportWithExplicitTimeAndForce() {
        registry.add("motion", false);

        assertFalse(registry.report("motion", true, 0L));
        assertTrue(registry.report("motion", true, 0L, true));
    }

    @Test
    void getAllValuesIsAnInsertionOrderedSnapshot() {
        registry.add("c", true);
        registry.add("a", false);
        registry.add("b", true);

        Map<String, Boolean> values = registry.getAllValues();
        assertEquals(List.of("c", "a", "b"), List.copyOf(values.keySet()));
        assertEquals(Map.of("a", false, "b", true, "c", true), values);
        assertEquals(List.of("c", "a", "b"), List.copyOf(registry.names()));

        registry.report("a", true, 0L, true);
        assertFalse(values.get("a"));
        assertThrows(UnsupportedOperationException.class, () -> values.put("d", true));
    }

    @Test
    void resetAllClearsPendingButKeepsValues() {
        StabilizedSignal motion = registry.add("motion", false);
        StabilizedSignal door = registry.add("door", true);

        registry.report("motion", true);
        registry.report("door", false);
        registry.resetAll();

        assertEquals(0, motion.pendingCount());
        assertEquals(0, door.pendingCount());
        assertEquals(Map.of("motion", false, "door", true), registry.getAllValues());
    }

    @Test
    void changingDefaultsDoesNotAffectExistingSignals() {
        StabilizedSignal before = registry.add("before", false);

        registry.setDefaultBufferMode(BufferMode.NONE);
        registry.setDefaults(registry.defaults().toBuilder()
                .withCountThreshold(TRUE_TO_FALSE, 9)
                .build());
        StabilizedSignal after = registry.add("after", false);

        assertEquals(BufferMode.BOTH, before.bufferMode());
        assertEquals(3, before.thresholds().countThreshold(TRUE_TO_FALSE));

        assertEquals(BufferMode.NONE, after.bufferMode());
        assertEquals(9, after.thresholds().countThreshold(TRUE_TO_FALSE));
        assertTrue(registry.report("after", true));
    }

    @Test
    void toStringListsSignalNames() {
        registry.add("motion", false);

        assertTrue(registry.toString().contains("motion"));
    }
}
