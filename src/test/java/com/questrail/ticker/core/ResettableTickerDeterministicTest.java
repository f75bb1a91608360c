package com.questrail.ticker.core;

import com.questrail.ticker.api.Tick;
import com.questrail.ticker.api.TickerClosedException;
import com.questrail.ticker.api.TickerState;
import com.questrail.ticker.config.TickerConfig;
import com.questrail.ticker.internal.time.Cancellable;
import com.questrail.ticker.internal.time.MonotonicScheduler;
import com.questrail.ticker.observability.RecordingObservabilitySink;
import com.questrail.ticker.observability.TickerErrorEvent;
import com.questrail.ticker.observability.TickerStateTransitionEvent;
import com.questrail.ticker.observability.TickerStateTransitionEvent.Cause;
import com.questrail.ticker.time.DeterministicScheduler;
import com.questrail.ticker.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResettableTickerDeterministicTest
 * -----------------------------------------------------------------------------
 * Drives the control loop with a manual clock and a deterministic scheduler, so
 * countdown deadlines can be asserted exactly.
 */
class ResettableTickerDeterministicTest {

    private static final Duration WAIT = Duration.ofSeconds(2);
    private static final Duration SHORT = Duration.ofMillis(50);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private ResettableTicker ticker;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        ticker = ResettableTicker.create(TickerConfig.builder()
            .withInterval(Duration.ofMillis(100))
            .withClock(clock)
            .withWallClock(() -> Instant.EPOCH)
            .withScheduler(scheduler)
            .withObservabilitySink(sink)
            .build());
    }

    @AfterEach
    void tearDown() {
        if (!ticker.isClosed()) {
            ticker.close();
        }
    }

    @Test
    void countdownIsArmedDuringConstruction() {
        assertEquals(1, scheduler.pendingCount());
        assertEquals(ms(100), scheduler.nextDeadlineNanos().getAsLong());
        assertEquals(TickerState.ACTIVE, ticker.state());
        assertEquals(Duration.ofMillis(100), ticker.interval());
    }

    @Test
    void firstTickArrivesAfterOneInterval() throws InterruptedException {
        clock.advanceMillis(99);
        scheduler.runDueTasks();
        assertTrue(ticker.ticks().poll(SHORT).isEmpty(), "No tick before the interval elapses");

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        Tick tick = ticker.ticks().poll(WAIT).orElseThrow();
        assertEquals(1, tick.sequence());
        assertEquals(ms(100), tick.monotonicNanos());
        assertEquals(Instant.EPOCH, tick.timestamp());
    }

    @Test
    void countdownIsRearmedAfterDelivery() throws InterruptedException {
        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertEquals(1, ticker.ticks().poll(WAIT).orElseThrow().sequence());

        assertTrue(scheduler.awaitPending(1, WAIT), "Countdown should be rearmed");
        assertEquals(ms(200), scheduler.nextDeadlineNanos().getAsLong());

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        Tick second = ticker.ticks().poll(WAIT).orElseThrow();
        assertEquals(2, second.sequence());
        assertEquals(ms(200), second.monotonicNanos());
    }

    @Test
    void resetMeasuresNextTickFromTheResetCall() throws InterruptedException {
        clock.advanceMillis(60);
        ticker.reset(Duration.ofMillis(30));

        assertEquals(1, scheduler.pendingCount(), "Original countdown should be cancelled");
        assertEquals(ms(90), scheduler.nextDeadlineNanos().getAsLong());
        assertEquals(Duration.ofMillis(30), ticker.interval());

        clock.advanceMillis(29);
        scheduler.runDueTasks();
        assertTrue(ticker.ticks().poll(SHORT).isEmpty());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertEquals(ms(90), ticker.ticks().poll(WAIT).orElseThrow().monotonicNanos());
    }

    @Test
    void stopDisarmsCountdownAndResetResumes() throws InterruptedException {
        ticker.stop();

        assertEquals(TickerState.PAUSED, ticker.state());
        assertEquals(0, scheduler.pendingCount());
        assertEquals(Duration.ofMillis(100), ticker.interval(), "Pause keeps the last interval");

        clock.advanceMillis(1_000);
        scheduler.runDueTasks();
        assertTrue(ticker.ticks().poll(SHORT).isEmpty(), "No tick while paused");
        assertFalse(ticker.ticks().isClosed(), "Pause leaves the stream open");

        ticker.reset(Duration.ofMillis(40));
        assertEquals(TickerState.ACTIVE, ticker.state());
        assertEquals(ms(1_040), scheduler.nextDeadlineNanos().getAsLong());

        clock.advanceMillis(40);
        scheduler.runDueTasks();
        assertEquals(1, ticker.ticks().poll(WAIT).orElseThrow().sequence());
    }

    @Test
    void negativeIntervalPauses() {
        ticker.reset(Duration.ofMillis(-5));
        assertEquals(TickerState.PAUSED, ticker.state());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void oversizedResetIsRejectedWithoutDisturbingCountdown() throws InterruptedException {
        clock.advance(Duration.ofMillis(40));

        assertThrows(IllegalArgumentException.class, () -> ticker.reset(Duration.ofSeconds(Long.MAX_VALUE / 2)));

        assertFalse(ticker.isClosed());
        assertEquals(TickerState.ACTIVE, ticker.state());
        assertEquals(Duration.ofMillis(100), ticker.interval());
        assertEquals(ms(100), scheduler.nextDeadlineNanos().getAsLong(), "Armed countdown is untouched");

        clock.advance(Duration.ofMillis(60));
        scheduler.runDueTasks();
        assertEquals(1, ticker.ticks().poll(WAIT).orElseThrow().sequence());
    }

    @Test
    void oversizedNegativeResetStillPauses() {
        ticker.reset(Duration.ofSeconds(-Long.MAX_VALUE / 2));

        assertEquals(TickerState.PAUSED, ticker.state());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void closeCancelsCountdownAndClosesStream() throws InterruptedException {
        ticker.close();

        assertTrue(ticker.isClosed());
        assertEquals(TickerState.TERMINATED, ticker.state());
        assertEquals(0, scheduler.pendingCount());
        assertTrue(ticker.ticks().isClosed());
        assertTrue(ticker.ticks().next().isEmpty());
        assertTrue(ticker.awaitTermination(Duration.ZERO));
    }

    @Test
    void closeWithdrawsTickWaitingForConsumer() throws InterruptedException {
        clock.advanceMillis(100);
        scheduler.runDueTasks();

        // Nobody consumes; the loop is parked handing the tick over.
        Thread.sleep(50);
        ticker.close();

        assertTrue(ticker.ticks().next().isEmpty(), "A withdrawn tick must never be observed");
        assertTrue(sink.getDeliveries().isEmpty());
    }

    @Test
    void observabilitySinkSeesLifecycle() throws InterruptedException {
        ticker.reset(Duration.ofMillis(10));
        ticker.stop();
        ticker.reset(Duration.ofMillis(20));

        clock.advanceMillis(20);
        scheduler.runDueTasks();
        ticker.ticks().poll(WAIT).orElseThrow();
        ticker.close();

        List<TickerStateTransitionEvent> transitions = sink.getStateTransitions();
        assertEquals(5, transitions.size());

        assertEquals(Cause.STARTED, transitions.get(0).cause());
        assertNull(transitions.get(0).oldState());

        assertEquals(Cause.RECONFIGURED, transitions.get(1).cause());
        assertFalse(transitions.get(1).isStateChange());
        assertEquals(Duration.ofMillis(10), transitions.get(1).interval());

        assertEquals(TickerState.PAUSED, transitions.get(2).newState());
        assertEquals(TickerState.ACTIVE, transitions.get(3).newState());

        TickerStateTransitionEvent last = transitions.get(4);
        assertEquals(Cause.RETIRED, last.cause());
        assertEquals(TickerState.ACTIVE, last.oldState());
        assertEquals(TickerState.TERMINATED, last.newState());

        assertEquals(1, sink.getDeliveries().size());
        assertEquals(ticker.name(), sink.getDeliveries().get(0).tickerName());
    }

    @Test
    void schedulerFailureRetiresTicker() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        MonotonicScheduler failing = new MonotonicScheduler() {
            @Override
            public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
                if (calls.incrementAndGet() > 1) {
                    throw new IllegalStateException("timer unavailable");
                }
                return () -> true;
            }
        };
        RecordingObservabilitySink failureSink = new RecordingObservabilitySink();
        ResettableTicker failingTicker = ResettableTicker.create(TickerConfig.builder()
            .withInterval(Duration.ofMillis(100))
            .withClock(clock)
            .withScheduler(failing)
            .withObservabilitySink(failureSink)
            .build());

        TickerClosedException thrown = assertThrows(TickerClosedException.class,
            () -> failingTicker.reset(Duration.ofMillis(10)));
        assertTrue(thrown.getCause() instanceof IllegalStateException);
        assertEquals("timer unavailable", thrown.getCause().getMessage());

        assertTrue(failingTicker.awaitTermination(WAIT));
        assertTrue(failingTicker.isClosed());
        assertTrue(failingTicker.ticks().next().isEmpty());
        assertTrue(failureSink.hasEventOfType(TickerErrorEvent.class));

        List<TickerStateTransitionEvent> transitions = failureSink.getStateTransitions();
        assertEquals(Cause.FAILED, transitions.get(transitions.size() - 1).cause());

        assertThrows(TickerClosedException.class, failingTicker::close);
    }

    private static long ms(long millis) {
        return Duration.ofMillis(millis).toNanos();
    }
}
