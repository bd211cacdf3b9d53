package com.questrail.stabilizer.observability;

/**
 * Why a committed value changed.
 */
public enum TransitionCause
{
    /**
     * A pending candidate met its count and duration thresholds.
     */
    STABILIZED,

    /**
     * The buffer mode does not stabilize the direction, so the first report
     * committed it.
     */
    UNBUFFERED,

    /**
     * The caller asked for an immediate commit.
     */
    FORCED,

    /**
     * An administrative reset assigned the value directly.
     */
    RESET
}
