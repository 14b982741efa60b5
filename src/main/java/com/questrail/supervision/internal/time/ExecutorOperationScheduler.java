package com.questrail.supervision.internal.time;

import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ExecutorOperationScheduler
 * =============================================================================
 * {@link OperationScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Deadlines</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling
 * time using the provided {@link MonotonicClock}. Callers computing deadlines
 * must use the same clock instance.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Callers (usually
 * {@code SupervisionRuntime}) are responsible for shutdown.</p>
 *
 * <h2>Threading</h2>
 * <p>With a single-threaded executor this reproduces the single logical
 * scheduler model: operations never run in parallel with each other. With a
 * pool, operations run in parallel and everything they share must be
 * thread-safe (services and events are).</p>
 */
public final class ExecutorOperationScheduler implements OperationScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ExecutorOperationScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable submit(Runnable task) {
        Objects.requireNonNull(task, "task");
        return new FutureCancellable(executor.submit(task));
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        return new FutureCancellable(executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS));
    }

    private static final class FutureCancellable implements Cancellable {
        private final Future<?> future;

        private FutureCancellable(Future<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // Running work is interrupted by its operation handle, not here.
            return future.cancel(false);
        }
    }
}
