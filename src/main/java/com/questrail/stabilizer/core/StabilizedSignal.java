package com.questrail.stabilizer.core;

import com.questrail.stabilizer.api.BufferMode;
import com.questrail.stabilizer.api.TransitionDirection;
import com.questrail.stabilizer.config.SignalConfig;
import com.questrail.stabilizer.config.ThresholdSet;
import com.questrail.stabilizer.observability.NullObservabilitySink;
import com.questrail.stabilizer.observability.PendingTransitionEvent;
import com.questrail.stabilizer.observability.SignalTransitionEvent;
import com.questrail.stabilizer.observability.StabilizerObservabilitySink;
import com.questrail.stabilizer.observability.TransitionCause;
import com.questrail.stabilizer.time.MonotonicClock;
import com.questrail.stabilizer.time.SystemMonotonicClock;
import com.questrail.stabilizer.time.SystemWallClock;
import com.questrail.stabilizer.time.WallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * StabilizedSignal
 * -----------------------------------------------------------------------------
 * A boolean whose committed value changes only after a candidate value has
 * persisted for a configured number of consecutive reports AND a configured
 * amount of time.
 *
 * <h2>States</h2>
 * <ul>
 *   <li><b>Stable</b> – a committed value and no candidate</li>
 *   <li><b>Pending</b> – a committed value plus a candidate (always the opposite
 *       value), the number of consecutive reports of it, and the monotonic time
 *       of its first report</li>
 * </ul>
 * There is no terminal state. {@link #report} is the only trigger besides
 * {@link #reset} and configuration changes.
 *
 * <h2>Invariants</h2>
 * After every public operation:
 * <ul>
 *   <li>a candidate, if present, differs from the committed value</li>
 *   <li>{@code pendingCount > 0} exactly when a candidate is present</li>
 *   <li>{@code pendingSince} is present exactly when a candidate is present</li>
 *   <li>a commit assigns the candidate and clears all pending state in one step</li>
 * </ul>
 *
 * <h2>Why both thresholds</h2>
 * Count and duration are combined with AND. A burst of reports within a single
 * instant cannot satisfy a duration requirement, and one long-held report
 * cannot satisfy a count requirement. Reporting the committed value again
 * abandons the candidate entirely; progress is never carried over.
 *
 * <h2>Configuration</h2>
 * Thresholds and buffer mode are mutable. A change applies from the next
 * {@link #report} call; it never commits or discards an in-flight candidate
 * by itself.
 *
 * <h2>Threading model</h2>
 * A single private lock ("monitor") guards all state, so every operation on
 * one signal is a critical section and reports are applied in call order.
 * Observability events are dispatched after the lock is released.
 */
public final class StabilizedSignal
{
    private final Object lock = new Object();

    private final String name;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final StabilizerObservabilitySink sink;

    private boolean value;

    /**
     * Candidate under evaluation; null when no transition is in progress.
     */
    private Boolean pendingValue;
    private int pendingCount;
    private long pendingSinceNanos;

    private ThresholdSet thresholds;
    private BufferMode bufferMode;

    public StabilizedSignal(
            String name,
            boolean initialValue,
            SignalConfig config,
            MonotonicClock clock,
            WallClock wallClock,
            StabilizerObservabilitySink sink
    ) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.value = initialValue;
        this.thresholds = config.thresholds();
        this.bufferMode = config.bufferMode();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the committed value.
     */
    public boolean value() {
        synchronized (lock) {
            return value;
        }
    }

    /**
     * Returns the candidate under evaluation, if any.
     */
    public Optional<Boolean> pendingValue() {
        synchronized (lock) {
            return Optional.ofNullable(pendingValue);
        }
    }

    /**
     * Returns the number of consecutive reports of the current candidate, or 0.
     */
    public int pendingCount() {
        synchronized (lock) {
            return pendingCount;
        }
    }

    /**
     * Returns the monotonic time of the current candidate's first report.
     */
    public OptionalLong pendingSinceNanos() {
        synchronized (lock) {
            return pendingValue == null ? OptionalLong.empty() : OptionalLong.of(pendingSinceNanos);
        }
    }

    /**
     * Returns how long the current candidate has been pending as of
     * {@code nowNanos}. Zero without a candidate; never negative.
     */
    public Duration pendingDuration(long nowNanos) {
        synchronized (lock) {
            return elapsedLocked(nowNanos);
        }
    }

    /**
     * {@link #pendingDuration(long)} measured against the injected clock.
     */
    public Duration pendingDuration() {
        return pendingDuration(clock.nowNanos());
    }

    /**
     * Reports an observation using the injected clock.
     *
     * @return the committed value after processing
     */
    public boolean report(boolean newValue) {
        return report(newValue, clock.nowNanos(), false);
    }

    /**
     * Reports an observation using the injected clock.
     *
     * @param forceImmediate commit a differing value at once, ignoring the
     *                       thresholds and buffer mode
     * @return the committed value after processing
     */
    public boolean report(boolean newValue, boolean forceImmediate) {
        return report(newValue, clock.nowNanos(), forceImmediate);
    }

    /**
     * Reports an observation made at {@code nowNanos}.
     *
     * @return the committed value after processing
     */
    public boolean report(boolean newValue, long nowNanos) {
        return report(newValue, nowNanos, false);
    }

    /**
     * Reports an observation made at {@code nowNanos}.
     *
     * <h3>Processing</h3>
     * <ol>
     *   <li>Reporting the committed value drops any candidate and changes
     *       nothing else.</li>
     *   <li>If {@code forceImmediate} is set, or the buffer mode does not
     *       stabilize this direction, the value is committed at once.</li>
     *   <li>Otherwise the report starts a candidate (count 1, timed from
     *       {@code nowNanos}) or extends the existing one by one, and the
     *       candidate is committed once its count and elapsed time both reach
     *       the thresholds resolved for this direction.</li>
     * </ol>
     *
     * @param newValue       the observed value
     * @param nowNanos       monotonic time of the observation
     * @param forceImmediate commit a differing value at once
     * @return the committed value after processing
     */
    public boolean report(boolean newValue, long nowNanos, boolean forceImmediate) {
        final boolean result;
        SignalTransitionEvent transition = null;
        PendingTransitionEvent started = null;
        PendingTransitionEvent cancelled = null;

        synchronized (lock) {
            if (newValue == value) {
                cancelled = cancelPendingLocked(nowNanos);
            } else {
                TransitionDirection direction = TransitionDirection.of(value, newValue);

                if (forceImmediate || !bufferMode.stabilizes(direction)) {
                    transition = commitLocked(
                            newValue,
                            forceImmediate ? TransitionCause.FORCED : TransitionCause.UNBUFFERED,
                            nowNanos);
                } else {
                    if (pendingValue == null || pendingValue != newValue) {
                        pendingValue = newValue;
                        pendingCount = 1;
                        pendingSinceNanos = nowNanos;
                        started = pendingEventLocked(nowNanos);
                    } else {
                        pendingCount++;
                    }

                    boolean countMet = pendingCount >= thresholds.countThreshold(direction);
                    boolean durationMet = elapsedLocked(nowNanos)
                            .compareTo(thresholds.durationThreshold(direction)) >= 0;
                    if (countMet && durationMet) {
                        transition = commitLocked(newValue, TransitionCause.STABILIZED, nowNanos);
                    }
                }
            }
            result = value;
        }

        // Sinks run outside of the lock.
        if (cancelled != null) {
            sink.onPendingCancelled(cancelled);
        }
        if (started != null) {
            sink.onPendingStarted(started);
        }
        if (transition != null) {
            sink.onTransition(transition);
        }
        return result;
    }

    /**
     * Drops any candidate. The committed value is preserved.
     */
    public void reset() {
        PendingTransitionEvent cancelled;
        synchronized (lock) {
            cancelled = cancelPendingLocked(clock.nowNanos());
        }
        if (cancelled != null) {
            sink.onPendingCancelled(cancelled);
        }
    }

    /**
     * Drops any candidate and assigns {@code newValue} directly. This is an
     * administrative override, not an observation: no threshold applies.
     */
    public void reset(boolean newValue) {
        PendingTransitionEvent cancelled;
        SignalTransitionEvent transition = null;
        synchronized (lock) {
            cancelled = cancelPendingLocked(clock.nowNanos());
            if (value != newValue) {
                transition = new SignalTransitionEvent(
                        wallClock.now(), name, value, newValue, TransitionCause.RESET, 0, Duration.ZERO);
                value = newValue;
            }
        }
        if (cancelled != null) {
            sink.onPendingCancelled(cancelled);
        }
        if (transition != null) {
            sink.onTransition(transition);
        }
    }

    public BufferMode bufferMode() {
        synchronized (lock) {
            return bufferMode;
        }
    }

    public void setBufferMode(BufferMode bufferMode) {
        Objects.requireNonNull(bufferMode, "bufferMode");
        synchronized (lock) {
            this.bufferMode = bufferMode;
        }
    }

    public ThresholdSet thresholds() {
        synchronized (lock) {
            return thresholds;
        }
    }

    public void setThresholds(ThresholdSet thresholds) {
        Objects.requireNonNull(thresholds, "thresholds");
        synchronized (lock) {
            this.thresholds = thresholds;
        }
    }

    /**
     * Replaces the symmetric count base; per-direction overrides are kept.
     *
     * @throws com.questrail.stabilizer.api.InvalidConfigurationException if
     *         {@code countThreshold < 1}; the configuration is left unchanged
     */
    public void setCountThreshold(int countThreshold) {
        synchronized (lock) {
            this.thresholds = thresholds.toBuilder().withCountThreshold(countThreshold).build();
        }
    }

    /**
     * Replaces the symmetric duration base; per-direction overrides are kept.
     *
     * @throws com.questrail.stabilizer.api.InvalidConfigurationException if
     *         the duration is negative; the configuration is left unchanged
     */
    public void setDurationThreshold(Duration durationThreshold) {
        Objects.requireNonNull(durationThreshold, "durationThreshold");
        synchronized (lock) {
            this.thresholds = thresholds.toBuilder().withDurationThreshold(durationThreshold).build();
        }
    }

    public SignalConfig config() {
        synchronized (lock) {
            return new SignalConfig(thresholds, bufferMode);
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "StabilizedSignal{name=" + name
                    + ", value=" + value
                    + ", pending=" + (pendingValue == null ? "none" : pendingValue + "x" + pendingCount)
                    + ", thresholds=" + thresholds
                    + ", bufferMode=" + bufferMode
                    + "}";
        }
    }

    // ------------------------
    // Locked helpers
    // ------------------------

    private Duration elapsedLocked(long nowNanos) {
        if (pendingValue == null) {
            return Duration.ZERO;
        }
        long elapsed = nowNanos - pendingSinceNanos;
        return elapsed <= 0 ? Duration.ZERO : Duration.ofNanos(elapsed);
    }

    private SignalTransitionEvent commitLocked(boolean newValue, TransitionCause cause, long nowNanos) {
        SignalTransitionEvent event = new SignalTransitionEvent(
                wallClock.now(), name, value, newValue, cause, pendingCount, elapsedLocked(nowNanos));
        value = newValue;
        clearPendingLocked();
        return event;
    }

    /**
     * Clears the candidate, returning an event describing it, or null if
     * there was none.
     */
    private PendingTransitionEvent cancelPendingLocked(long nowNanos) {
        if (pendingValue == null) {
            return null;
        }
        PendingTransitionEvent event = pendingEventLocked(nowNanos);
        clearPendingLocked();
        return event;
    }

    private PendingTransitionEvent pendingEventLocked(long nowNanos) {
        return new PendingTransitionEvent(
                wallClock.now(), name, value, pendingValue, pendingCount, elapsedLocked(nowNanos));
    }

    private void clearPendingLocked() {
        pendingValue = null;
        pendingCount = 0;
        pendingSinceNanos = 0L;
    }

    /**
     * Builder for standalone signals. Registries create their signals through
     * the same builder, seeded with their defaults.
     */
    public static final class Builder {
        private final String name;
        private boolean initialValue;
        private SignalConfig config = SignalConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private StabilizerObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder withInitialValue(boolean initialValue) {
            this.initialValue = initialValue;
            return this;
        }

        public Builder withConfig(SignalConfig config) {
            this.config = config;
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

        public StabilizedSignal build() {
            return new StabilizedSignal(name, initialValue, config, clock, wallClock, sink);
        }
    }
}
