package com.questrail.stabilizer.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every stabilization decision.
 *
 * <h2>Binding invariant</h2>
 * Pending-duration measurement and duration-threshold checks MUST use a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for observability.
 *
 * <p>
 * Implementations should be backed by {@link System#nanoTime()} in production
 * and by a manually advanced clock in tests.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
