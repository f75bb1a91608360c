package com.questrail.ticker.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside a ticker's control loop.
 */
public record TickerErrorEvent(
    Instant timestamp,
    String tickerName,
    String message,
    Throwable cause
) {
}
