package com.questrail.ticker.observability;

import com.questrail.ticker.api.TickerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a state transition of a ticker's control loop.
 *
 * @param oldState {@code null} for {@link Cause#STARTED}
 * @param interval the interval in effect after the transition
 */
public record TickerStateTransitionEvent(
    Instant timestamp,
    String tickerName,
    TickerState oldState,
    TickerState newState,
    Duration interval,
    Cause cause
) {
    /**
     * What drove the transition.
     */
    public enum Cause {
        /** Loop started with the construction interval. */
        STARTED,
        /** A reset or stop request was applied. */
        RECONFIGURED,
        /** Retirement by close or by cancellation of the parent scope. */
        RETIRED,
        /** Retirement forced by an unexpected error inside the loop. */
        FAILED
    }

    /**
     * Checks whether the state actually changed (a reset while active does not).
     */
    public boolean isStateChange() {
        return oldState != newState;
    }
}
