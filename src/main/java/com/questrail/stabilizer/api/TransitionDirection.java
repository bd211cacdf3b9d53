package com.questrail.stabilizer.api;

/**
 * TransitionDirection
 * -----------------------------------------------------------------------------
 * The two ways a committed boolean value can change.
 *
 * Thresholds may differ per direction (see
 * {@link com.questrail.stabilizer.config.ThresholdSet}) and a
 * {@link BufferMode} may exempt one direction from stabilization entirely.
 */
public enum TransitionDirection
{
    /**
     * The committed value moves from {@code false} to {@code true}.
     */
    FALSE_TO_TRUE,

    /**
     * The committed value moves from {@code true} to {@code false}.
     */
    TRUE_TO_FALSE;

    /**
     * Returns the direction of a change from {@code from} to {@code to}.
     *
     * @throws IllegalArgumentException if {@code from == to}; there is no
     *         transition between equal values
     */
    public static TransitionDirection of(boolean from, boolean to) {
        if (from == to) {
            throw new IllegalArgumentException("No transition between equal values: " + from);
        }
        return to ? FALSE_TO_TRUE : TRUE_TO_FALSE;
    }

    /**
     * Returns the value a signal holds after a transition in this direction.
     */
    public boolean target() {
        return this == FALSE_TO_TRUE;
    }
}
