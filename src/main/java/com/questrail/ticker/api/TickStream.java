package com.questrail.ticker.api;

import java.time.Duration;
import java.util.Optional;

/**
 * TickStream
 * =============================================================================
 * Read side of a ticker's output: a single-slot, unbuffered handoff.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Each tick is handed to exactly one consumer.</li>
 *   <li>At most one tick is in flight at a time; the producer waits for a
 *       consumer before producing the next one.</li>
 *   <li>The stream closes exactly once, when the ticker is retired. After that
 *       every read returns empty immediately.</li>
 * </ul>
 *
 * <p>Iterating the stream with a for-each loop ends when the stream closes,
 * which is how consumer loops terminate without a separate stop signal. If the
 * iterating thread is interrupted the iteration also ends; the interrupt status
 * is preserved.</p>
 */
public interface TickStream extends Iterable<Tick>
{
    /**
     * Blocks until the next tick is available or the stream closes.
     *
     * @return the tick, or empty if the stream is closed
     */
    Optional<Tick> next() throws InterruptedException;

    /**
     * Waits up to {@code timeout} for the next tick.
     *
     * @return the tick, or empty on timeout or closure; see {@link #isClosed()}
     */
    Optional<Tick> poll(Duration timeout) throws InterruptedException;

    /**
     * Returns {@code true} once the stream has been closed.
     */
    boolean isClosed();
}
