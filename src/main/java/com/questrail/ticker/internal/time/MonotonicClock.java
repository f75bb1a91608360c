package com.questrail.ticker.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every timing decision the ticker makes.
 *
 * <h2>Binding invariant</h2>
 * Countdown deadlines and tick ordering MUST use a monotonic time source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for the
 * observational timestamp carried by a tick.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
