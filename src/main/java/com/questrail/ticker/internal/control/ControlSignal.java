package com.questrail.ticker.internal.control;

import com.questrail.ticker.api.TickerClosedException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ControlSignal
 * -----------------------------------------------------------------------------
 * Messages consumed by a ticker's control loop.
 *
 * <h2>Role in the architecture</h2>
 * The control loop is the only code that mutates ticker state. Every other
 * thread (callers, the timer thread, cancellation callbacks) communicates with
 * it by enqueuing one of these signals. The loop takes them one at a time, so
 * transitions are serialized without an instance-wide lock.
 */
public sealed interface ControlSignal
        permits ControlSignal.Reconfigure, ControlSignal.TimerFired, ControlSignal.Retire
{
    /**
     * A request to change the interval. Non-positive intervals pause the ticker.
     *
     * <p>The request is a synchronous handoff: the submitting thread waits in
     * {@link #awaitOutcome()} until the loop {@link #claim() claims} and
     * {@link #applied() applies} it, or until retirement {@link #reject()
     * rejects} it. Exactly one of claim and reject succeeds. A claimed request
     * whose application throws is completed with {@link #failed(Throwable)}.</p>
     */
    final class Reconfigure implements ControlSignal
    {
        private static final int PENDING = 0;
        private static final int CLAIMED = 1;
        private static final int REJECTED = 2;

        private final Duration interval;
        private final AtomicInteger status = new AtomicInteger(PENDING);
        private final CompletableFuture<Boolean> outcome = new CompletableFuture<>();

        public Reconfigure(Duration interval) {
            this.interval = Objects.requireNonNull(interval, "interval");
        }

        public Duration interval() {
            return interval;
        }

        public boolean pauses() {
            return interval.isZero() || interval.isNegative();
        }

        /**
         * Called by the control loop before applying the request.
         *
         * @return {@code false} if retirement already rejected it
         */
        public boolean claim() {
            return status.compareAndSet(PENDING, CLAIMED);
        }

        /**
         * Called by the control loop once the claimed request has been applied.
         */
        public void applied() {
            outcome.complete(Boolean.TRUE);
        }

        /**
         * Called by the control loop when applying the claimed request threw.
         */
        public void failed(Throwable cause) {
            outcome.completeExceptionally(cause);
        }

        /**
         * Called on retirement.
         *
         * @return {@code false} if the loop already claimed it
         */
        public boolean reject() {
            if (status.compareAndSet(PENDING, REJECTED)) {
                outcome.complete(Boolean.FALSE);
                return true;
            }
            return false;
        }

        /**
         * Blocks until the request is applied, rejected or failed.
         *
         * @return {@code true} if applied, {@code false} if rejected
         * @throws TickerClosedException carrying the failure if applying it threw
         */
        public boolean awaitOutcome() {
            try {
                return outcome.join();
            } catch (CompletionException e) {
                throw new TickerClosedException(e.getCause());
            }
        }

        @Override
        public String toString() {
            return "Reconfigure[" + interval + "]";
        }
    }

    /**
     * Posted by the timer thread when the countdown armed under
     * {@code generation} expires. Fires from an older generation are stale.
     *
     * @param firedAtNanos monotonic reading taken on the timer thread
     * @param firedAt      wall-clock reading taken on the timer thread
     */
    record TimerFired(long generation, long firedAtNanos, Instant firedAt) implements ControlSignal {
        public TimerFired {
            Objects.requireNonNull(firedAt, "firedAt");
        }
    }

    /**
     * Posted when the ticker's cancellation scope fires, to wake a loop blocked
     * waiting for the next signal.
     */
    record Retire() implements ControlSignal {
        public static final Retire INSTANCE = new Retire();
    }
}
