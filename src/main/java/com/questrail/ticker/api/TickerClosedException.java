package com.questrail.ticker.api;

/**
 * Thrown by {@link Ticker#reset}, {@link Ticker#stop} and {@link Ticker#close}
 * once the ticker has been retired.
 *
 * <p>Callers should treat this as "already gone", not as a fault. When the
 * ticker retired because applying the caller's own request failed, the failure
 * is attached as the cause.</p>
 */
public final class TickerClosedException extends RuntimeException
{
    public TickerClosedException() {
        super("ticker already closed");
    }

    /**
     * The ticker retired because of {@code cause} while handling the call.
     */
    public TickerClosedException(Throwable cause) {
        super("ticker closed after failure", cause);
    }
}
