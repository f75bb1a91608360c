package com.questrail.ticker.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A single tick delivered by a {@link Ticker}.
 *
 * @param sequence       1-based position of this tick in the ticker's output
 * @param monotonicNanos monotonic reading at the moment the countdown fired;
 *                       non-decreasing across ticks of one ticker
 * @param timestamp      wall-clock time of the fire, for display and logging only
 */
public record Tick(long sequence, long monotonicNanos, Instant timestamp) {
    public Tick {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
