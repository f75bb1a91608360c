package com.questrail.ticker.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of TickerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTickerObservabilitySink implements TickerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTickerObservabilitySink.class);

    @Override
    public void onStateTransition(TickerStateTransitionEvent event) {
        if (event.isStateChange()) {
            log.debug("Ticker {}: {} -> {} ({}, interval {})",
                event.tickerName(),
                event.oldState(),
                event.newState(),
                event.cause(),
                event.interval());
        } else {
            log.debug("Ticker {}: interval now {}", event.tickerName(), event.interval());
        }
    }

    @Override
    public void onTickDelivered(TickDeliveredEvent event) {
        log.trace("Ticker {}: delivered tick #{}", event.tickerName(), event.tick().sequence());
    }

    @Override
    public void onError(TickerErrorEvent event) {
        log.error("Ticker {}: {}", event.tickerName(), event.message(), event.cause());
    }
}
