package com.questrail.ticker.lifecycle;

import com.questrail.ticker.config.TickerConfig;
import com.questrail.ticker.core.ResettableTicker;
import com.questrail.ticker.internal.time.Cancellable;
import com.questrail.ticker.internal.time.MonotonicScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationScopeTest
 * -----------------------------------------------------------------------------
 * Propagation and callback semantics of the cancellation tree.
 */
class CancellationScopeTest {

    @Test
    void backgroundIsNeverCancelled() {
        CancellationScope background = CancellationScope.background();

        assertSame(background, CancellationScope.background());
        assertFalse(background.isCancelled());
        assertThrows(UnsupportedOperationException.class, background::cancel);
        assertFalse(background.isCancelled());
    }

    @Test
    void cancelIsIdempotent() {
        CancellationScope scope = CancellationScope.create();

        assertTrue(scope.cancel());
        assertFalse(scope.cancel());
        assertTrue(scope.isCancelled());
    }

    @Test
    void cancellationPropagatesToDescendantsOnly() {
        CancellationScope root = CancellationScope.create();
        CancellationScope child = root.newChild();
        CancellationScope grandchild = child.newChild();
        CancellationScope sibling = CancellationScope.create();

        child.cancel();

        assertFalse(root.isCancelled(), "Cancelling a child leaves its parent live");
        assertTrue(child.isCancelled());
        assertTrue(grandchild.isCancelled());
        assertFalse(sibling.isCancelled());
    }

    @Test
    void childOfCancelledScopeStartsCancelled() {
        CancellationScope root = CancellationScope.create();
        root.cancel();

        assertTrue(root.newChild().isCancelled());
    }

    @Test
    void cancelledChildUnregistersFromParent() {
        CancellationScope root = CancellationScope.create();
        List<CancellationScope> children = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            children.add(root.newChild());
        }
        assertEquals(10, root.childCount());

        children.forEach(CancellationScope::cancel);

        assertEquals(0, root.childCount());
        assertFalse(root.isCancelled());
    }

    @Test
    void failedTickerConstructionRegistersNoChild() {
        CancellationScope parent = CancellationScope.create();
        MonotonicScheduler unavailable = (deadlineNanos, task) -> {
            throw new IllegalStateException("timer unavailable");
        };

        assertThrows(IllegalArgumentException.class,
            () -> ResettableTicker.create(Duration.ofSeconds(Long.MAX_VALUE / 2), parent));
        assertThrows(IllegalStateException.class, () -> ResettableTicker.create(TickerConfig.builder()
            .withInterval(Duration.ofMillis(10))
            .withParent(parent)
            .withScheduler(unavailable)
            .build()));

        assertEquals(0, parent.childCount());
    }

    @Test
    void retiredTickerUnregistersFromParent() {
        CancellationScope parent = CancellationScope.create();
        ResettableTicker ticker = ResettableTicker.create(Duration.ofSeconds(1), parent);
        assertEquals(1, parent.childCount());

        ticker.close();

        assertEquals(0, parent.childCount());
        assertFalse(parent.isCancelled());
    }

    @Test
    void callbacksRunOnceOnCancel() {
        CancellationScope scope = CancellationScope.create();
        AtomicInteger runs = new AtomicInteger();
        scope.onCancel(runs::incrementAndGet);

        scope.cancel();
        scope.cancel();

        assertEquals(1, runs.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationScope scope = CancellationScope.create();
        scope.cancel();
        AtomicInteger runs = new AtomicInteger();

        Cancellable registration = scope.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertFalse(registration.cancel());
    }

    @Test
    void unregisteredCallbackDoesNotRun() {
        CancellationScope scope = CancellationScope.create();
        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = scope.onCancel(runs::incrementAndGet);

        assertTrue(registration.cancel());
        scope.cancel();

        assertEquals(0, runs.get());
    }

    @Test
    void callbacksOnBackgroundAreIgnored() {
        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = CancellationScope.background().onCancel(runs::incrementAndGet);

        assertFalse(registration.cancel());
        assertEquals(0, runs.get());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationScope scope = CancellationScope.create();
        AtomicInteger runs = new AtomicInteger();
        scope.onCancel(() -> {
            throw new IllegalStateException("first");
        });
        scope.onCancel(runs::incrementAndGet);
        scope.onCancel(() -> {
            throw new IllegalArgumentException("second");
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class, scope::cancel);

        assertEquals(1, runs.get());
        assertTrue(scope.isCancelled());
        assertEquals(1, thrown.getSuppressed().length);
        assertTrue(thrown.getSuppressed()[0] instanceof IllegalArgumentException);
    }

    @Test
    void awaitCancellationWakesOnCancel() throws InterruptedException {
        CancellationScope scope = CancellationScope.create();
        assertFalse(scope.awaitCancellation(Duration.ofMillis(20)));

        CountDownLatch woke = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                scope.awaitCancellation();
                woke.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        scope.cancel();

        assertTrue(woke.await(2, TimeUnit.SECONDS));
        assertTrue(scope.awaitCancellation(Duration.ZERO));
    }
}
