package com.questrail.stabilizer.core;

import com.questrail.stabilizer.api.BufferMode;
import com.questrail.stabilizer.api.DuplicateSignalException;
import com.questrail.stabilizer.api.SignalNotFoundException;
import com.questrail.stabilizer.config.SignalConfig;
import com.questrail.stabilizer.observability.NullObservabilitySink;
import com.questrail.stabilizer.observability.SignalRegistrationEvent;
import com.questrail.stabilizer.observability.StabilizerObservabilitySink;
import com.questrail.stabilizer.time.MonotonicClock;
import com.questrail.stabilizer.time.SystemMonotonicClock;
import com.questrail.stabilizer.time.SystemWallClock;
import com.questrail.stabilizer.time.WallClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * SignalRegistry
 * -----------------------------------------------------------------------------
 * A named collection of {@link StabilizedSignal}s sharing default
 * configuration.
 *
 * <h2>Defaults</h2>
 * The registry holds a {@link SignalConfig} that seeds every signal it
 * creates. Per-signal overrides given to {@link #add(String, boolean, UnaryOperator)}
 * are applied on top of it. The result is copied into the signal, so changing
 * the registry defaults later only affects signals added afterwards.
 *
 * <h2>Names</h2>
 * Names are unique. Adding an existing name fails with
 * {@link DuplicateSignalException}; every lookup, report or removal of an
 * unknown name fails with {@link SignalNotFoundException}. Enumeration follows
 * insertion order.
 *
 * <h2>Threading model</h2>
 * The name map is guarded by the registry's own lock. Reports are forwarded to
 * the signal after that lock is released, so each signal serializes its own
 * reports independently.
 */
public final class SignalRegistry
{
    private final Object lock = new Object();

    private final Map<String, StabilizedSignal> signals = new LinkedHashMap<>();
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final StabilizerObservabilitySink sink;

    private SignalConfig defaults;

    /**
     * Creates a registry with {@link SignalConfig#defaults()}, system clocks and
     * no observability.
     */
    public SignalRegistry() {
        this(SignalConfig.defaults(), SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE,
                NullObservabilitySink.INSTANCE);
    }

    public SignalRegistry(
            SignalConfig defaults,
            MonotonicClock clock,
            WallClock wallClock,
            StabilizerObservabilitySink sink
    ) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------
    // Defaults
    // ------------------------

    public SignalConfig defaults() {
        synchronized (lock) {
            return defaults;
        }
    }

    /**
     * Replaces the defaults used for signals added from now on.
     */
    public void setDefaults(SignalConfig defaults) {
        Objects.requireNonNull(defaults, "defaults");
        synchronized (lock) {
            this.defaults = defaults;
        }
    }

    /**
     * Replaces only the default buffer mode. Existing signals keep theirs.
     */
    public void setDefaultBufferMode(BufferMode bufferMode) {
        Objects.requireNonNull(bufferMode, "bufferMode");
        synchronized (lock) {
            this.defaults = defaults.toBuilder().withBufferMode(bufferMode).build();
        }
    }

    // ------------------------
    // Membership
    // ------------------------

    /**
     * Adds a signal configured entirely from the registry defaults.
     */
    public StabilizedSignal add(String name, boolean initialValue) {
        return add(name, initialValue, UnaryOperator.identity());
    }

    /**
     * Adds a signal whose configuration starts from the registry defaults and
     * is then adjusted by {@code overrides}, e.g.
     * {@code b -> b.withCountThreshold(3)}.
     *
     * @throws DuplicateSignalException if the name is already registered
     * @throws com.questrail.stabilizer.api.InvalidConfigurationException if an
     *         override is out of range
     */
    public StabilizedSignal add(String name, boolean initialValue, UnaryOperator<SignalConfig.Builder> overrides) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(overrides, "overrides");

        final StabilizedSignal signal;
        synchronized (lock) {
            if (signals.containsKey(name)) {
                throw new DuplicateSignalException(name);
            }
            SignalConfig config = overrides.apply(defaults.toBuilder()).build();
            signal = StabilizedSignal.builder(name)
                    .withInitialValue(initialValue)
                    .withConfig(config)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withObservabilitySink(sink)
                    .build();
            signals.put(name, signal);
        }

        sink.onSignalAdded(new SignalRegistrationEvent(wallClock.now(), name, initialValue, signal.config()));
        return signal;
    }

    /**
     * Removes and returns the named signal. Callers must not keep reporting
     * to the returned instance through this registry.
     *
     * @throws SignalNotFoundException if the name is not registered
     */
    public StabilizedSignal remove(String name) {
        Objects.requireNonNull(name, "name");
        final StabilizedSignal removed;
        synchronized (lock) {
            removed = signals.remove(name);
        }
        if (removed == null) {
            throw new SignalNotFoundException(name);
        }

        sink.onSignalRemoved(new SignalRegistrationEvent(wallClock.now(), name, removed.value(), removed.config()));
        return removed;
    }

    /**
     * @throws SignalNotFoundException if the name is not registered
     */
    public StabilizedSignal get(String name) {
        return find(name).orElseThrow(() -> new SignalNotFoundException(name));
    }

    public Optional<StabilizedSignal> find(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            return Optional.ofNullable(signals.get(name));
        }
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public int size() {
        synchronized (lock) {
            return signals.size();
        }
    }

    /**
     * Returns a snapshot of the registered names in insertion order.
     */
    public Set<String> names() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(signals.keySet()));
        }
    }

    // ------------------------
    // Reporting and queries
    // ------------------------

    /**
     * Reports to the named signal using the registry clock.
     *
     * @return the signal's committed value after processing
     * @throws SignalNotFoundException if the name is not registered
     */
    public boolean report(String name, boolean newValue) {
        return get(name).report(newValue);
    }

    /**
     * @see StabilizedSignal#report(boolean, long)
     */
    public boolean report(String name, boolean newValue, long nowNanos) {
        return get(name).report(newValue, nowNanos);
    }

    /**
     * @see StabilizedSignal#report(boolean, long, boolean)
     */
    public boolean report(String name, boolean newValue, long nowNanos, boolean forceImmediate) {
        return get(name).report(newValue, nowNanos, forceImmediate);
    }

    /**
     * @throws SignalNotFoundException if the name is not registered
     */
    public boolean getValue(String name) {
        return get(name).value();
    }

    /**
     * Returns a snapshot of every committed value, keyed by name in insertion
     * order.
     */
    public Map<String, Boolean> getAllValues() {
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (StabilizedSignal signal : snapshotSignals()) {
            values.put(signal.name(), signal.value());
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * Drops the pending candidate of every signal. Committed values are not
     * changed.
     */
    public void resetAll() {
        for (StabilizedSignal signal : snapshotSignals()) {
            signal.reset();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "SignalRegistry{defaults=" + defaults + ", signals=" + signals.keySet() + "}";
        }
    }

    private List<StabilizedSignal> snapshotSignals() {
        synchronized (lock) {
            return new ArrayList<>(signals.values());
        }
    }

    public static final class Builder {
        private SignalConfig defaults = SignalConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private StabilizerObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withDefaults(SignalConfig defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(StabilizerObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public SignalRegistry build() {
            return new SignalRegistry(defaults, clock, wallClock, sink);
        }
    }
}
