package com.questrail.ticker.core;

import com.questrail.ticker.api.Tick;
import com.questrail.ticker.api.TickStream;
import com.questrail.ticker.api.Ticker;
import com.questrail.ticker.api.TickerClosedException;
import com.questrail.ticker.api.TickerState;
import com.questrail.ticker.config.TickerConfig;
import com.questrail.ticker.internal.control.ControlSignal;
import com.questrail.ticker.internal.control.ControlSignal.Reconfigure;
import com.questrail.ticker.internal.control.ControlSignal.Retire;
import com.questrail.ticker.internal.control.ControlSignal.TimerFired;
import com.questrail.ticker.internal.time.Cancellable;
import com.questrail.ticker.internal.time.MonotonicClock;
import com.questrail.ticker.internal.time.MonotonicScheduler;
import com.questrail.ticker.internal.time.WallClock;
import com.questrail.ticker.lifecycle.CancellationScope;
import com.questrail.ticker.observability.TickDeliveredEvent;
import com.questrail.ticker.observability.TickerErrorEvent;
import com.questrail.ticker.observability.TickerObservabilitySink;
import com.questrail.ticker.observability.TickerStateTransitionEvent;
import com.questrail.ticker.observability.TickerStateTransitionEvent.Cause;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ResettableTicker
 * =============================================================================
 * {@link Ticker} implementation driven by a dedicated control loop thread.
 *
 * <h2>Threading Model</h2>
 * Each instance owns one control loop thread. Callers never touch the countdown
 * or the producer side of the output stream; they enqueue {@link ControlSignal}s
 * and the loop processes them one at a time:
 * <ul>
 *   <li>{@link Reconfigure} from {@link #reset} and {@link #stop}</li>
 *   <li>{@link TimerFired} from the scheduler thread when a countdown expires</li>
 *   <li>{@link Retire} from the cancellation callback</li>
 * </ul>
 * The cancellation state is checked before every signal, so retirement wins
 * whenever it races another signal.
 *
 * <h2>Countdown generations</h2>
 * Every arm and disarm advances a generation counter. A {@link TimerFired}
 * carrying an older generation is ignored, which is how a fire that is already
 * queued when a reset or pause arrives gets discarded.
 *
 * <h2>Retirement</h2>
 * <pre>
 *   cancel lifecycle scope → await loop exit → close output stream
 * </pre>
 * runs exactly once, whether started by {@link #close()} or by the loop itself
 * after the parent scope was cancelled. Concurrent {@code close()} callers wait
 * for that single run; all but the first then get {@link TickerClosedException}.
 */
public final class ResettableTicker implements Ticker {

    private static final AtomicLong INSTANCE_COUNTER = new AtomicLong();

    private final String name;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final TickerObservabilitySink observabilitySink;

    private final CancellationScope lifecycle;
    private final BlockingQueue<ControlSignal> signals = new LinkedBlockingQueue<>();
    private final TickChannel output = new TickChannel();
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private final CountDownLatch retirementDone = new CountDownLatch(1);
    private final AtomicBoolean retirementStarted = new AtomicBoolean(false);
    private final Thread loopThread;

    private volatile TickerState state = TickerState.ACTIVE;
    private volatile Duration interval;

    // Confined to the control loop once it has started.
    private Cancellable armedCountdown;
    private long armedGeneration;
    private long deliveredTicks;

    private ResettableTicker(TickerConfig config) {
        this.name = config.threadNamePrefix() + "-" + INSTANCE_COUNTER.incrementAndGet();
        this.clock = config.clock();
        this.wallClock = config.wallClock();
        this.scheduler = config.scheduler();
        this.observabilitySink = config.observabilitySink();
        this.interval = config.interval();

        // Armed on the caller's thread so the first deadline is one interval from construction.
        // The child scope is derived only afterwards, so a failed arm leaves nothing registered
        // with the parent.
        arm(interval);
        this.lifecycle = config.parent().newChild();

        this.loopThread = new Thread(this::runControlLoop, name);
        this.loopThread.setDaemon(true);

        lifecycle.onCancel(this::onLifecycleCancelled);
        loopThread.start();
    }

    /**
     * Creates a ticker that can only be retired by {@link #close()}.
     *
     * @throws IllegalArgumentException if {@code interval} is not positive or
     *                                  not representable in nanoseconds
     */
    public static ResettableTicker create(Duration interval) {
        return create(interval, CancellationScope.background());
    }

    /**
     * Creates a ticker that is also retired when {@code parent} is cancelled.
     *
     * @throws IllegalArgumentException if {@code interval} is not positive or
     *                                  not representable in nanoseconds
     * @throws NullPointerException     if {@code interval} or {@code parent} is null
     */
    public static ResettableTicker create(Duration interval, CancellationScope parent) {
        Objects.requireNonNull(parent, "parent");
        return create(TickerConfig.builder()
            .withInterval(interval)
            .withParent(parent)
            .build());
    }

    public static ResettableTicker create(TickerConfig config) {
        return new ResettableTicker(Objects.requireNonNull(config, "config"));
    }

    /**
     * Name of this ticker, also used as the control loop thread name.
     */
    public String name() {
        return name;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code newInterval} is positive but
     *         too large to be expressed in nanoseconds; the ticker is unaffected
     * @throws TickerClosedException    if the ticker is retired, or retires
     *         because applying this request failed (the failure is the cause)
     */
    @Override
    public void reset(Duration newInterval) {
        Objects.requireNonNull(newInterval, "newInterval");
        if (!newInterval.isZero() && !newInterval.isNegative()) {
            TickerConfig.requireNanosRepresentable(newInterval);
        }
        requireNotLoopThread("reset");

        if (lifecycle.isCancelled()) {
            throw new TickerClosedException();
        }

        Reconfigure request = new Reconfigure(newInterval);
        signals.add(request);

        // The loop may have drained the queue before this request landed.
        if (lifecycle.isCancelled()) {
            request.reject();
        }
        if (!request.awaitOutcome()) {
            throw new TickerClosedException();
        }
    }

    @Override
    public void stop() {
        reset(Duration.ZERO);
    }

    @Override
    public void close() {
        requireNotLoopThread("close");
        if (!retire()) {
            throw new TickerClosedException();
        }
    }

    @Override
    public boolean isClosed() {
        return lifecycle.isCancelled();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        loopExited.await();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return loopExited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public TickerState state() {
        return state;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public TickStream ticks() {
        return output;
    }

    @Override
    public String toString() {
        return "ResettableTicker[" + name + ", " + state + ", " + interval + "]";
    }

    /**
     * Runs the retirement sequence once.
     *
     * @return {@code true} for the caller that ran it
     */
    private boolean retire() {
        if (!retirementStarted.compareAndSet(false, true)) {
            awaitUninterruptibly(retirementDone);
            return false;
        }
        try {
            lifecycle.cancel();
            awaitUninterruptibly(loopExited);
            output.close();
        } finally {
            retirementDone.countDown();
        }
        return true;
    }

    private void onLifecycleCancelled() {
        signals.offer(Retire.INSTANCE);
        output.withdraw();
    }

    private void runControlLoop() {
        Cause exitCause = Cause.RETIRED;
        publishTransition(null, TickerState.ACTIVE, Cause.STARTED);
        try {
            while (!lifecycle.isCancelled()) {
                ControlSignal signal = signals.take();
                if (lifecycle.isCancelled()) {
                    rejectIfReconfigure(signal);
                    break;
                }
                if (signal instanceof Reconfigure request) {
                    if (request.claim()) {
                        try {
                            applyInterval(request);
                        } catch (RuntimeException e) {
                            request.failed(e);
                            throw e;
                        }
                        request.applied();
                    }
                } else if (signal instanceof TimerFired fired) {
                    if (!deliver(fired)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            exitCause = Cause.FAILED;
            observabilitySink.onError(new TickerErrorEvent(
                wallClock.now(),
                name,
                "Control loop failed",
                e
            ));
        } finally {
            try {
                lifecycle.cancel();
                disarm();
                rejectPendingRequests();
                TickerState previous = state;
                state = TickerState.TERMINATED;
                publishTransition(previous, TickerState.TERMINATED, exitCause);
            } finally {
                loopExited.countDown();
                retire();
            }
        }
    }

    private void applyInterval(Reconfigure request) {
        TickerState previous = state;
        disarm();
        if (request.pauses()) {
            state = TickerState.PAUSED;
        } else {
            interval = request.interval();
            arm(interval);
            state = TickerState.ACTIVE;
        }
        publishTransition(previous, state, Cause.RECONFIGURED);
    }

    /**
     * Hands a fired tick to a consumer, racing retirement.
     *
     * @return {@code false} if retirement won and the loop must exit
     */
    private boolean deliver(TimerFired fired) throws InterruptedException {
        if (state != TickerState.ACTIVE || fired.generation() != armedGeneration) {
            return true;
        }
        armedCountdown = null;

        Tick tick = new Tick(deliveredTicks + 1, fired.firedAtNanos(), fired.firedAt());
        if (!output.send(tick, lifecycle::isCancelled)) {
            return false;
        }
        deliveredTicks++;
        arm(interval);
        observabilitySink.onTickDelivered(new TickDeliveredEvent(name, tick));
        return true;
    }

    private void arm(Duration delay) {
        long generation = ++armedGeneration;
        armedCountdown = scheduler.scheduleAfter(delay, clock, () ->
            signals.offer(new TimerFired(generation, clock.nowNanos(), wallClock.now())));
    }

    private void disarm() {
        Cancellable countdown = armedCountdown;
        armedCountdown = null;
        armedGeneration++;
        if (countdown != null) {
            countdown.cancel();
        }
    }

    private void rejectPendingRequests() {
        List<ControlSignal> pending = new ArrayList<>();
        signals.drainTo(pending);
        for (ControlSignal signal : pending) {
            rejectIfReconfigure(signal);
        }
    }

    private static void rejectIfReconfigure(ControlSignal signal) {
        if (signal instanceof Reconfigure request) {
            request.reject();
        }
    }

    private void publishTransition(TickerState oldState, TickerState newState, Cause cause) {
        observabilitySink.onStateTransition(new TickerStateTransitionEvent(
            wallClock.now(),
            name,
            oldState,
            newState,
            interval,
            cause
        ));
    }

    private void requireNotLoopThread(String operation) {
        if (Thread.currentThread() == loopThread) {
            throw new IllegalStateException(operation + "() must not be called from the ticker's own control loop");
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
