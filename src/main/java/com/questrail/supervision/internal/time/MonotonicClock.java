package com.questrail.supervision.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for delayed operation starts and bounded waits.
 *
 * <p>
 * Deadlines handed to {@link OperationScheduler#scheduleAtNanos(long, Runnable)}
 * are expressed in this clock's ticks. Wall-clock time is used only for
 * diagnostic timestamps (see {@link WallClock}).
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
