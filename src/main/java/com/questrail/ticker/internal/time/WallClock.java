package com.questrail.ticker.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for tick timestamps and observability only.
 *
 * <p>
 * This clock may jump due to NTP adjustments or explicit time setting.
 * It MUST NOT be used to compute deadlines.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
