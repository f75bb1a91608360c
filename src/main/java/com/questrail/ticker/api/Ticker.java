package com.questrail.ticker.api;

import java.time.Duration;

/**
 * Ticker
 * -----------------------------------------------------------------------------
 * A periodic tick emitter whose interval can be changed at runtime, which can
 * be paused and resumed, and which can be retired so that every consumer of its
 * {@link #ticks() output} is released.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   create          → ACTIVE(interval), first tick after one interval
 *   reset(d &gt; 0)    → ACTIVE(d), next tick one d after the call
 *   stop()          → PAUSED, no ticks, stream stays open
 *   close()         → TERMINATED, stream closed, further calls rejected
 * </pre>
 *
 * <h2>Threading</h2>
 * All methods are safe to call from any thread. State changes are applied by a
 * single internal control loop, so a reset, a pause, a tick delivery and a
 * retirement never interleave.
 *
 * <h2>Retirement</h2>
 * Retirement happens on the first {@link #close()} or when the parent
 * cancellation scope supplied at construction is cancelled. It is terminal.
 */
public interface Ticker extends AutoCloseable
{
    /**
     * Changes the interval. Any pending countdown is discarded; if
     * {@code interval} is positive the next tick is due one {@code interval}
     * after this call, otherwise the ticker pauses.
     *
     * <p>Blocks until the control loop has applied the change or the ticker is
     * retired, whichever happens first. A tick already waiting for a consumer
     * is handed over before the change is applied.</p>
     *
     * @throws IllegalArgumentException if {@code interval} is positive but not
     *         representable in nanoseconds
     * @throws TickerClosedException    if the ticker is retired, including when
     *         it retires because applying this change failed
     */
    void reset(Duration interval);

    /**
     * Pauses the ticker. Equivalent to {@code reset(Duration.ZERO)}.
     *
     * @throws TickerClosedException if the ticker is retired
     */
    void stop();

    /**
     * Retires the ticker and closes its output stream. Blocks until the control
     * loop has exited.
     *
     * @throws TickerClosedException on every call after the first, including
     *         calls that race the first
     */
    @Override
    void close();

    /**
     * Returns {@code true} once retirement has begun. The output stream closes
     * shortly after.
     */
    boolean isClosed();

    /**
     * Blocks until the control loop has exited.
     */
    void awaitTermination() throws InterruptedException;

    /**
     * Blocks until the control loop has exited or {@code timeout} elapses.
     *
     * @return {@code true} if the loop exited
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * Last state published by the control loop.
     */
    TickerState state();

    /**
     * Last positive interval applied by the control loop. Unchanged by a pause.
     */
    Duration interval();

    /**
     * The output stream.
     */
    TickStream ticks();
}
