/**
 * Stabilization core
 * =============================================================================
 *
 * {@link com.questrail.stabilizer.core.StabilizedSignal} is the per-signal state
 * machine; {@link com.questrail.stabilizer.core.SignalRegistry} is a named
 * container of them with shared defaults.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Code in this package MUST:
 * <ul>
 *   <li>Measure elapsed time only through a
 *       {@link com.questrail.stabilizer.time.MonotonicClock} or an explicit
 *       monotonic {@code nowNanos} argument</li>
 *   <li>Never spawn threads or schedule work; a duration threshold is a value
 *       checked on the next report, not a timer</li>
 *   <li>Report changes through the observability sink rather than logging
 *       directly</li>
 * </ul>
 */
package com.questrail.stabilizer.core;
