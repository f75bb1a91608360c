package com.questrail.ticker.observability;

import com.questrail.ticker.api.Tick;

/**
 * Record emitted after a consumer has taken a tick from the output stream.
 */
public record TickDeliveredEvent(
    String tickerName,
    Tick tick
) {
}
