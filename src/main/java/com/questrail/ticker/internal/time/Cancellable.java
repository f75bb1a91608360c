package com.questrail.ticker.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for an armed countdown or a registered callback.
 *
 * <p>
 * The ticker's control loop only ever needs to disarm what it armed, so this
 * interface stays tiny. It is implemented by:
 * <ul>
 *   <li>a {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>the deterministic scheduler used by tests</li>
 *   <li>callback registrations on a {@code CancellationScope}</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
