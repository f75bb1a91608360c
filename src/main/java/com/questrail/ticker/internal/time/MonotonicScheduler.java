package com.questrail.ticker.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot countdown surface used by the ticker's control loop.
 *
 * <h2>Binding invariant</h2>
 * Scheduling MUST be expressed in monotonic nanoseconds or durations, never in
 * wall-clock instants.
 *
 * <h2>Threading</h2>
 * Tasks run on a scheduler-owned thread. The ticker's tasks only post a signal
 * back to the control loop; they never touch ticker state directly.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration measured from {@code clock}'s current reading.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
