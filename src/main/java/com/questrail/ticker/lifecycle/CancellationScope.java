package com.questrail.ticker.lifecycle;

import com.questrail.ticker.internal.time.Cancellable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CancellationScope
 * =============================================================================
 * A node in a tree of one-shot cancellation tokens.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #cancel()} is idempotent and may be called from any thread.</li>
 *   <li>Cancelling a scope cancels every scope derived from it via
 *       {@link #newChild()}, recursively.</li>
 *   <li>Once cancelled, a scope never becomes live again.</li>
 *   <li>A cancelled child unregisters itself from its parent, so long-lived
 *       parents do not accumulate retired children.</li>
 * </ul>
 *
 * <h2>Roots</h2>
 * {@link #background()} is the shared, never-cancelled root. {@link #create()}
 * returns a fresh cancellable scope derived from it.
 *
 * <h2>Usage</h2>
 * <pre>
 *   CancellationScope owner = CancellationScope.create();
 *   Ticker a = ResettableTicker.create(Duration.ofSeconds(1), owner);
 *   Ticker b = ResettableTicker.create(Duration.ofSeconds(5), owner);
 *   ...
 *   owner.cancel();   // retires a and b
 * </pre>
 */
public final class CancellationScope
{
    private static final CancellationScope BACKGROUND = new CancellationScope(null, false);

    private final CancellationScope parent;
    private final boolean cancellable;

    private final Object lock = new Object();
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Set<CancellationScope> children = new LinkedHashSet<>();
    private final Set<Registration> callbacks = new LinkedHashSet<>();

    private volatile boolean cancelled;

    private CancellationScope(CancellationScope parent, boolean cancellable) {
        this.parent = parent;
        this.cancellable = cancellable;
    }

    /**
     * The shared root scope. It is never cancelled; {@link #cancel()} on it is
     * rejected.
     */
    public static CancellationScope background() {
        return BACKGROUND;
    }

    /**
     * A new cancellable scope with no parent other than {@link #background()}.
     */
    public static CancellationScope create() {
        return BACKGROUND.newChild();
    }

    /**
     * Derives a child scope. If this scope is already cancelled the child is
     * returned already cancelled.
     */
    public CancellationScope newChild() {
        CancellationScope child = new CancellationScope(this, true);
        if (!cancellable) {
            return child;
        }
        synchronized (lock) {
            if (!cancelled) {
                children.add(child);
                return child;
            }
        }
        child.cancel();
        return child;
    }

    /**
     * Cancels this scope and all of its descendants, then runs the registered
     * callbacks on the calling thread.
     *
     * @return {@code true} if this call performed the cancellation,
     *         {@code false} if the scope was already cancelled
     * @throws UnsupportedOperationException on the {@link #background()} scope
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("background scope cannot be cancelled");
        }

        final List<CancellationScope> childrenSnapshot;
        final List<Registration> callbackSnapshot;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            childrenSnapshot = new ArrayList<>(children);
            callbackSnapshot = new ArrayList<>(callbacks);
            children.clear();
            callbacks.clear();
        }
        cancelledLatch.countDown();

        if (parent != null) {
            parent.removeChild(this);
        }

        RuntimeException failure = null;
        for (CancellationScope child : childrenSnapshot) {
            try {
                child.cancel();
            } catch (RuntimeException e) {
                failure = accumulate(failure, e);
            }
        }
        for (Registration registration : callbackSnapshot) {
            try {
                registration.action.run();
            } catch (RuntimeException e) {
                failure = accumulate(failure, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    /**
     * Returns {@code true} once cancellation has reached this scope, either by
     * a direct {@link #cancel()} or by an ancestor's cancellation propagating
     * down to it. While an ancestor's {@code cancel()} is still walking its
     * descendants this may briefly remain {@code false}.
     */
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers {@code action} to run when this scope is cancelled. If the
     * scope is already cancelled the action runs immediately on the calling
     * thread.
     *
     * @return a handle that unregisters the action; its {@code cancel()}
     *         returns {@code false} once the action has run
     */
    public Cancellable onCancel(Runnable action) {
        Objects.requireNonNull(action, "action");
        if (!cancellable) {
            return () -> false;
        }

        Registration registration = new Registration(action);
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(registration);
                return registration;
            }
        }
        action.run();
        return () -> false;
    }

    /**
     * Blocks until this scope is cancelled.
     */
    public void awaitCancellation() throws InterruptedException {
        cancelledLatch.await();
    }

    /**
     * Blocks until this scope is cancelled or {@code timeout} elapses.
     *
     * @return {@code true} if the scope was cancelled
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        return cancelledLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    int childCount() {
        synchronized (lock) {
            return children.size();
        }
    }

    private void removeChild(CancellationScope child) {
        synchronized (lock) {
            children.remove(child);
        }
    }

    private boolean removeCallback(Registration registration) {
        synchronized (lock) {
            return callbacks.remove(registration);
        }
    }

    private static RuntimeException accumulate(RuntimeException first, RuntimeException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private final class Registration implements Cancellable {
        private final Runnable action;

        private Registration(Runnable action) {
            this.action = action;
        }

        @Override
        public boolean cancel() {
            return removeCallback(this);
        }
    }
}
