package com.questrail.ticker.config;

import com.questrail.ticker.internal.time.MonotonicClock;
import com.questrail.ticker.internal.time.MonotonicScheduler;
import com.questrail.ticker.internal.time.ScheduledExecutorScheduler;
import com.questrail.ticker.internal.time.SharedTimerExecutor;
import com.questrail.ticker.internal.time.SystemMonotonicClock;
import com.questrail.ticker.internal.time.SystemWallClock;
import com.questrail.ticker.internal.time.WallClock;
import com.questrail.ticker.lifecycle.CancellationScope;
import com.questrail.ticker.observability.NullObservabilitySink;
import com.questrail.ticker.observability.TickerObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * TickerConfig
 * -----------------------------------------------------------------------------
 * Construction parameters for a {@code ResettableTicker}.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>interval</b>: initial tick interval; must be strictly positive
 *       and representable in nanoseconds.</li>
 *   <li><b>parent</b>: cancellation scope whose cancellation retires the
 *       ticker. Defaults to {@link CancellationScope#background()}.</li>
 *   <li><b>clock</b>: monotonic clock used for deadlines and tick ordering.</li>
 *   <li><b>wallClock</b>: source of the observational tick timestamp.</li>
 *   <li><b>scheduler</b>: countdown scheduler. It must compute delays with the
 *       same clock as {@code clock}. Defaults to the shared timer thread.</li>
 *   <li><b>observabilitySink</b>: receives transitions, deliveries and errors.</li>
 *   <li><b>threadNamePrefix</b>: prefix for the control loop thread name.</li>
 * </ul>
 */
public record TickerConfig(
        Duration interval,
        CancellationScope parent,
        MonotonicClock clock,
        WallClock wallClock,
        MonotonicScheduler scheduler,
        TickerObservabilitySink observabilitySink,
        String threadNamePrefix
) {
    public static final String DEFAULT_THREAD_NAME_PREFIX = "resettable-ticker";

    public TickerConfig {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got " + interval);
        }
        requireNanosRepresentable(interval);
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
    }

    /**
     * Production wiring: system clocks, shared timer thread, no observability.
     */
    public static TickerConfig defaults(Duration interval) {
        return builder().withInterval(interval).build();
    }

    /**
     * Rejects a positive interval too large to be expressed in nanoseconds,
     * the unit countdowns are scheduled in (roughly 292 years).
     *
     * @throws IllegalArgumentException if {@code interval.toNanos()} overflows
     */
    public static Duration requireNanosRepresentable(Duration interval) {
        try {
            interval.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("interval too large: " + interval, e);
        }
        return interval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration interval;
        private CancellationScope parent = CancellationScope.background();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private TickerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;

        public Builder withInterval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder withParent(CancellationScope parent) {
            this.parent = parent;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(TickerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withThreadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        public TickerConfig build() {
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null && clock != null) {
                effectiveScheduler = new ScheduledExecutorScheduler(SharedTimerExecutor.instance(), clock);
            }
            return new TickerConfig(
                interval,
                parent,
                clock,
                wallClock,
                effectiveScheduler,
                observabilitySink,
                threadNamePrefix
            );
        }
    }
}
