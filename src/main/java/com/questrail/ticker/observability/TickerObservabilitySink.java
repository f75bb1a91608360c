package com.questrail.ticker.observability;

/**
 * Receives observability events from ticker control loops.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the control loop thread and must not block.</p>
 */
public interface TickerObservabilitySink {
    /**
     * Called after the control loop changes state or applies a new interval.
     */
    void onStateTransition(TickerStateTransitionEvent event);

    /**
     * Called after a tick has been handed to a consumer.
     */
    void onTickDelivered(TickDeliveredEvent event);

    /**
     * Called when the control loop fails unexpectedly. The ticker retires
     * right after.
     */
    void onError(TickerErrorEvent event);
}
