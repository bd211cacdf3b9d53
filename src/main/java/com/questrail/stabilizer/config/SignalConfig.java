package com.questrail.stabilizer.config;

import com.questrail.stabilizer.api.BufferMode;
import com.questrail.stabilizer.api.TransitionDirection;

import java.time.Duration;
import java.util.Objects;

/**
 * Complete stabilization configuration for one signal: thresholds plus the
 * buffer mode that decides which directions they apply to.
 *
 * <p>A registry keeps one of these as its defaults and seeds a
 * {@link Builder} from it for every signal it creates, so omitted per-signal
 * overrides fall back to the registry's values at creation time.</p>
 */
public record SignalConfig(
    ThresholdSet thresholds,
    BufferMode bufferMode
) {
    public SignalConfig {
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(bufferMode, "bufferMode");
    }

    /**
     * Count 1, duration zero, {@link BufferMode#BOTH}.
     */
    public static SignalConfig defaults() {
        return new SignalConfig(ThresholdSet.defaults(), BufferMode.BOTH);
    }

    public static Builder builder() {
        return defaults().toBuilder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private final ThresholdSet.Builder thresholds;
        private BufferMode bufferMode;

        private Builder(SignalConfig seed) {
            this.thresholds = seed.thresholds().toBuilder();
            this.bufferMode = seed.bufferMode();
        }

        /**
         * Replaces every threshold, including per-direction overrides.
         */
        public Builder withThresholds(ThresholdSet thresholds) {
            Objects.requireNonNull(thresholds, "thresholds");
            this.thresholds
                .clearOverrides()
                .withCountThreshold(thresholds.countThreshold())
                .withDurationThreshold(thresholds.durationThreshold());
            thresholds.countThresholdFalseToTrue()
                .ifPresent(c -> this.thresholds.withCountThreshold(TransitionDirection.FALSE_TO_TRUE, c));
            thresholds.countThresholdTrueToFalse()
                .ifPresent(c -> this.thresholds.withCountThreshold(TransitionDirection.TRUE_TO_FALSE, c));
            thresholds.durationThresholdFalseToTrue()
                .ifPresent(d -> this.thresholds.withDurationThreshold(TransitionDirection.FALSE_TO_TRUE, d));
            thresholds.durationThresholdTrueToFalse()
                .ifPresent(d -> this.thresholds.withDurationThreshold(TransitionDirection.TRUE_TO_FALSE, d));
            return this;
        }

        public Builder withCountThreshold(int countThreshold) {
            thresholds.withCountThreshold(countThreshold);
            return this;
        }

        public Builder withDurationThreshold(Duration durationThreshold) {
            thresholds.withDurationThreshold(durationThreshold);
            return this;
        }

        public Builder withCountThreshold(TransitionDirection direction, int countThreshold) {
            thresholds.withCountThreshold(direction, countThreshold);
            return this;
        }

        public Builder withDurationThreshold(TransitionDirection direction, Duration durationThreshold) {
            thresholds.withDurationThreshold(direction, durationThreshold);
            return this;
        }

        public Builder withBufferMode(BufferMode bufferMode) {
            this.bufferMode = bufferMode;
            return this;
        }

        public SignalConfig build() {
            return new SignalConfig(thresholds.build(), bufferMode);
        }
    }
}
