package com.questrail.stabilizer.config;

import com.questrail.stabilizer.api.InvalidConfigurationException;
import com.questrail.stabilizer.api.TransitionDirection;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * ThresholdSet
 * -----------------------------------------------------------------------------
 * Count and duration requirements a pending candidate must meet before it is
 * committed.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>countThreshold</b>: Consecutive reports of the candidate needed to
 *       commit it. Symmetric base, at least 1.</li>
 *   <li><b>durationThreshold</b>: Time the candidate must have been pending,
 *       measured from its first report. Symmetric base, non-negative.</li>
 *   <li><b>countThresholdFalseToTrue / countThresholdTrueToFalse</b>: Optional
 *       per-direction overrides of the count base.</li>
 *   <li><b>durationThresholdFalseToTrue / durationThresholdTrueToFalse</b>:
 *       Optional per-direction overrides of the duration base.</li>
 * </ul>
 *
 * <h2>Resolution</h2>
 * {@link #countThreshold(TransitionDirection)} and
 * {@link #durationThreshold(TransitionDirection)} always yield a concrete value:
 * the override for that direction when present, otherwise the base. Both
 * requirements must be met for a commit.
 */
public record ThresholdSet(
        int countThreshold,
        Duration durationThreshold,
        OptionalInt countThresholdFalseToTrue,
        OptionalInt countThresholdTrueToFalse,
        Optional<Duration> durationThresholdFalseToTrue,
        Optional<Duration> durationThresholdTrueToFalse
) {
    private static final ThresholdSet DEFAULTS = symmetric(1, Duration.ZERO);

    /**
     * Canonical constructor with validation.
     */
    public ThresholdSet {
        Objects.requireNonNull(durationThreshold, "durationThreshold");
        Objects.requireNonNull(countThresholdFalseToTrue, "countThresholdFalseToTrue");
        Objects.requireNonNull(countThresholdTrueToFalse, "countThresholdTrueToFalse");
        Objects.requireNonNull(durationThresholdFalseToTrue, "durationThresholdFalseToTrue");
        Objects.requireNonNull(durationThresholdTrueToFalse, "durationThresholdTrueToFalse");

        requireCount("countThreshold", countThreshold);
        countThresholdFalseToTrue.ifPresent(c -> requireCount("countThresholdFalseToTrue", c));
        countThresholdTrueToFalse.ifPresent(c -> requireCount("countThresholdTrueToFalse", c));

        requireDuration("durationThreshold", durationThreshold);
        durationThresholdFalseToTrue.ifPresent(d -> requireDuration("durationThresholdFalseToTrue", d));
        durationThresholdTrueToFalse.ifPresent(d -> requireDuration("durationThresholdTrueToFalse", d));
    }

    /**
     * Count 1, duration zero, no overrides: every report of a new value
     * commits it.
     */
    public static ThresholdSet defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a set that applies the same requirements in both directions.
     */
    public static ThresholdSet symmetric(int countThreshold, Duration durationThreshold) {
        return new ThresholdSet(
                countThreshold,
                durationThreshold,
                OptionalInt.empty(),
                OptionalInt.empty(),
                Optional.empty(),
                Optional.empty()
        );
    }

    /**
     * Resolves the count requirement for a transition in the given direction.
     */
    public int countThreshold(TransitionDirection direction) {
        Objects.requireNonNull(direction, "direction");
        return switch (direction) {
            case FALSE_TO_TRUE -> countThresholdFalseToTrue.orElse(countThreshold);
            case TRUE_TO_FALSE -> countThresholdTrueToFalse.orElse(countThreshold);
        };
    }

    /**
     * Resolves the duration requirement for a transition in the given direction.
     */
    public Duration durationThreshold(TransitionDirection direction) {
        Objects.requireNonNull(direction, "direction");
        return switch (direction) {
            case FALSE_TO_TRUE -> durationThresholdFalseToTrue.orElse(durationThreshold);
            case TRUE_TO_FALSE -> durationThresholdTrueToFalse.orElse(durationThreshold);
        };
    }

    /**
     * Returns {@code true} if both directions resolve to the same count and
     * the same duration, whether or not overrides are present.
     */
    public boolean isSymmetric() {
        return countThreshold(TransitionDirection.FALSE_TO_TRUE) == countThreshold(TransitionDirection.TRUE_TO_FALSE)
                && durationThreshold(TransitionDirection.FALSE_TO_TRUE)
                        .equals(durationThreshold(TransitionDirection.TRUE_TO_FALSE));
    }

    /**
     * Returns the single count requirement shared by both directions.
     *
     * @throws IllegalStateException if the directions resolve differently
     */
    public int symmetricCountThreshold() {
        int falseToTrue = countThreshold(TransitionDirection.FALSE_TO_TRUE);
        int trueToFalse = countThreshold(TransitionDirection.TRUE_TO_FALSE);
        if (falseToTrue != trueToFalse) {
            throw new IllegalStateException(
                    "Count thresholds differ: false->true=" + falseToTrue + ", true->false=" + trueToFalse);
        }
        return falseToTrue;
    }

    /**
     * Returns the single duration requirement shared by both directions.
     *
     * @throws IllegalStateException if the directions resolve differently
     */
    public Duration symmetricDurationThreshold() {
        Duration falseToTrue = durationThreshold(TransitionDirection.FALSE_TO_TRUE);
        Duration trueToFalse = durationThreshold(TransitionDirection.TRUE_TO_FALSE);
        if (!falseToTrue.equals(trueToFalse)) {
            throw new IllegalStateException(
                    "Duration thresholds differ: false->true=" + falseToTrue + ", true->false=" + trueToFalse);
        }
        return falseToTrue;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    private static void requireCount(String field, int value) {
        if (value < 1) {
            throw new InvalidConfigurationException(field + " must be at least 1, was " + value);
        }
    }

    private static void requireDuration(String field, Duration value) {
        if (value.isNegative()) {
            throw new InvalidConfigurationException(field + " cannot be negative, was " + value);
        }
    }

    public static final class Builder {
        private int countThreshold;
        private Duration durationThreshold;
        private OptionalInt countThresholdFalseToTrue;
        private OptionalInt countThresholdTrueToFalse;
        private Optional<Duration> durationThresholdFalseToTrue;
        private Optional<Duration> durationThresholdTrueToFalse;

        private Builder(ThresholdSet seed) {
            this.countThreshold = seed.countThreshold;
            this.durationThreshold = seed.durationThreshold;
            this.countThresholdFalseToTrue = seed.countThresholdFalseToTrue;
            this.countThresholdTrueToFalse = seed.countThresholdTrueToFalse;
            this.durationThresholdFalseToTrue = seed.durationThresholdFalseToTrue;
            this.durationThresholdTrueToFalse = seed.durationThresholdTrueToFalse;
        }

        public Builder withCountThreshold(int countThreshold) {
            this.countThreshold = countThreshold;
            return this;
        }

        public Builder withDurationThreshold(Duration durationThreshold) {
            this.durationThreshold = durationThreshold;
            return this;
        }

        public Builder withCountThreshold(TransitionDirection direction, int countThreshold) {
            Objects.requireNonNull(direction, "direction");
            if (direction == TransitionDirection.FALSE_TO_TRUE) {
                this.countThresholdFalseToTrue = OptionalInt.of(countThreshold);
            } else {
                this.countThresholdTrueToFalse = OptionalInt.of(countThreshold);
            }
            return this;
        }

        public Builder withDurationThreshold(TransitionDirection direction, Duration durationThreshold) {
            Objects.requireNonNull(direction, "direction");
            Objects.requireNonNull(durationThreshold, "durationThreshold");
            if (direction == TransitionDirection.FALSE_TO_TRUE) {
                this.durationThresholdFalseToTrue = Optional.of(durationThreshold);
            } else {
                this.durationThresholdTrueToFalse = Optional.of(durationThreshold);
            }
            return this;
        }

        /**
         * Drops every per-direction override so both directions fall back to
         * the base values.
         */
        public Builder clearOverrides() {
            this.countThresholdFalseToTrue = OptionalInt.empty();
            this.countThresholdTrueToFalse = OptionalInt.empty();
            this.durationThresholdFalseToTrue = Optional.empty();
            this.durationThresholdTrueToFalse = Optional.empty();
            return this;
        }

        public ThresholdSet build() {
            return new ThresholdSet(
                    countThreshold,
                    durationThreshold,
                    countThresholdFalseToTrue,
                    countThresholdTrueToFalse,
                    durationThresholdFalseToTrue,
                    durationThresholdTrueToFalse
            );
        }
    }
}
