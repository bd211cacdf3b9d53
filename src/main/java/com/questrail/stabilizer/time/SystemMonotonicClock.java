package com.questrail.stabilizer.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Never goes backward</li>
 *   <li>Not affected by NTP, DST or manual clock changes</li>
 *   <li>Only meaningful for elapsed time, not absolute timestamps</li>
 * </ul>
 *
 * <p>This is the clock signals and registries use when none is supplied.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
