package com.questrail.stabilizer.api;

import java.util.Objects;

/**
 * BufferMode
 * -----------------------------------------------------------------------------
 * Selects which transition directions are subject to stabilization.
 *
 * A transition that is not stabilized commits on the first report of the new
 * value, regardless of the configured count and duration thresholds.
 *
 * <h2>The Four Modes</h2>
 * <ul>
 *   <li>{@link #BOTH}          – stabilize false→true and true→false</li>
 *   <li>{@link #TRUE_TO_FALSE} – stabilize only when leaving {@code true};
 *       false→true is immediate</li>
 *   <li>{@link #FALSE_TO_TRUE} – stabilize only when leaving {@code false};
 *       true→false is immediate</li>
 *   <li>{@link #NONE}          – every report commits immediately</li>
 * </ul>
 *
 * A typical use of the one-sided modes is a fault indication that must be
 * raised at once but cleared only after it has stayed clear for a while.
 */
public enum BufferMode
{
    BOTH,
    TRUE_TO_FALSE,
    FALSE_TO_TRUE,
    NONE;

    /**
     * Returns {@code true} if a transition in the given direction must satisfy
     * the thresholds before it is committed.
     *
     * @param direction the direction of the proposed change
     */
    public boolean stabilizes(TransitionDirection direction) {
        Objects.requireNonNull(direction, "direction");
        return switch (this) {
            case BOTH -> true;
            case TRUE_TO_FALSE -> direction == TransitionDirection.TRUE_TO_FALSE;
            case FALSE_TO_TRUE -> direction == TransitionDirection.FALSE_TO_TRUE;
            case NONE -> false;
        };
    }
}
