package com.questrail.ticker.observability;

/**
 * No-op implementation of TickerObservabilitySink.
 */
public final class NullObservabilitySink implements TickerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(TickerStateTransitionEvent event) {}

    @Override
    public void onTickDelivered(TickDeliveredEvent event) {}

    @Override
    public void onError(TickerErrorEvent event) {}
}
