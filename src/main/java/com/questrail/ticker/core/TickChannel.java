package com.questrail.ticker.core;

import com.questrail.ticker.api.Tick;
import com.questrail.ticker.api.TickStream;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * TickChannel
 * =============================================================================
 * Single-slot rendezvous between one producer (a ticker's control loop) and any
 * number of consumers.
 *
 * <h2>Producer side</h2>
 * {@link #send(Tick, BooleanSupplier)} places a tick in the slot and waits until
 * a consumer takes it or the abort condition becomes true. Whoever flips the
 * abort condition must call {@link #withdraw()} afterwards: it empties the slot
 * so that no consumer can take the tick once the abort is visible, and makes
 * the producer re-check the condition.
 *
 * <h2>Consumer side</h2>
 * See {@link TickStream}. A tick that the producer withdrew after an abort is
 * never observed by a consumer.
 *
 * <h2>Closing</h2>
 * {@link #close()} is called once, after the producer has stopped for good. It
 * releases every waiting consumer.
 */
public final class TickChannel implements TickStream
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition filledOrClosed = lock.newCondition();
    private final Condition takenOrWoken = lock.newCondition();

    private Tick slot;
    private Tick lastTaken;
    private volatile boolean closed;

    /**
     * Offers {@code tick} and waits for a consumer to take it.
     *
     * @return {@code true} if a consumer took the tick; {@code false} if
     *         {@code abort} became true first, in which case the tick is withdrawn
     * @throws IllegalStateException if the channel is closed
     */
    boolean send(Tick tick, BooleanSupplier abort) throws InterruptedException {
        Objects.requireNonNull(tick, "tick");
        Objects.requireNonNull(abort, "abort");

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("send on closed tick channel");
            }
            if (abort.getAsBoolean()) {
                return false;
            }

            slot = tick;
            filledOrClosed.signalAll();

            try {
                while (lastTaken != tick) {
                    if (abort.getAsBoolean()) {
                        return false;
                    }
                    takenOrWoken.await();
                }
                return true;
            } finally {
                if (slot == tick) {
                    slot = null;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Withdraws a tick still waiting for a consumer and makes a producer blocked
     * in {@link #send} re-check its abort condition.
     */
    void withdraw() {
        lock.lock();
        try {
            slot = null;
            takenOrWoken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Idempotent.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            slot = null;
            filledOrClosed.signalAll();
            takenOrWoken.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Tick> next() throws InterruptedException {
        return receive(false, 0L);
    }

    @Override
    public Optional<Tick> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return receive(true, timeout.toNanos());
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public Iterator<Tick> iterator() {
        return new TickIterator();
    }

    private Optional<Tick> receive(boolean timed, long nanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (slot == null) {
                if (closed) {
                    return Optional.empty();
                }
                if (timed) {
                    if (nanos <= 0L) {
                        return Optional.empty();
                    }
                    nanos = filledOrClosed.awaitNanos(nanos);
                } else {
                    filledOrClosed.await();
                }
            }
            Tick tick = slot;
            slot = null;
            lastTaken = tick;
            takenOrWoken.signalAll();
            return Optional.of(tick);
        } finally {
            lock.unlock();
        }
    }

    private final class TickIterator implements Iterator<Tick> {
        private Tick pending;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            try {
                Optional<Tick> tick = TickChannel.this.next();
                if (tick.isPresent()) {
                    pending = tick.get();
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exhausted = true;
            return false;
        }

        @Override
        public Tick next() {
            if (!hasNext()) {
                throw new NoSuchElementException("tick stream closed");
            }
            Tick tick = pending;
            pending = null;
            return tick;
        }
    }
}
