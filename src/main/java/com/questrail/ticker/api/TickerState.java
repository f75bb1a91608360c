package com.questrail.ticker.api;

/**
 * Control loop state of a {@link Ticker}.
 */
public enum TickerState {
    /** Countdown armed; a tick is produced every interval. */
    ACTIVE,
    /** Countdown disarmed by a pause request; the output stream stays open. */
    PAUSED,
    /** Control loop exited. Terminal. */
    TERMINATED
}
