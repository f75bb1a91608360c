package com.questrail.ticker.internal.time;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SharedTimerExecutor
 * =============================================================================
 * Process-wide timer thread shared by every ticker that does not supply its own
 * {@link MonotonicScheduler}.
 *
 * <p>Timer tasks only enqueue a signal for a ticker's control loop, so a single
 * daemon thread is enough. Cancelled countdowns are removed from the work queue
 * immediately so that frequent resets do not accumulate dead tasks.</p>
 */
public final class SharedTimerExecutor {

    private SharedTimerExecutor() {}

    public static ScheduledExecutorService instance() {
        return Holder.EXECUTOR;
    }

    private static final class Holder {
        private static final ScheduledExecutorService EXECUTOR = create();

        private static ScheduledExecutorService create() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory());
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "resettable-ticker-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
