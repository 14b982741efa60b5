package com.questrail.supervision.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * OperationScheduler
 * =============================================================================
 * The scheduling capability that services, pools and events are handed
 * explicitly at construction time.
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>run a unit of work as soon as possible ({@link #submit(Runnable)})</li>
 *   <li>run a unit of work at or after a monotonic deadline</li>
 *   <li>request cancellation of work that has not started (the returned
 *       {@link Cancellable})</li>
 * </ul>
 *
 * <p>
 * Cancellation of work that is already running is not the scheduler's
 * concern; operation handles implement that cooperatively on top of this
 * interface.
 * </p>
 *
 * <p>
 * Passing a scheduler explicitly (instead of reaching for a process-wide
 * executor) lets several independent services run side by side, and lets
 * tests substitute a deterministic implementation.
 * </p>
 */
public interface OperationScheduler
{
    /**
     * Schedule a task to run as soon as the scheduler allows.
     *
     * @param task runnable task
     * @return cancellation handle; cancelling after the task started has no effect
     */
    Cancellable submit(Runnable task);

    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Convenience method: schedule after a duration using a provided monotonic clock.
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
