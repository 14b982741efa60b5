package com.questrail.supervision.internal.time.netty;

import com.questrail.supervision.internal.time.Cancellable;
import com.questrail.supervision.internal.time.MonotonicClock;
import com.questrail.supervision.internal.time.OperationScheduler;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoopScheduler
 * =============================================================================
 * {@link OperationScheduler} that runs every operation on one Netty
 * {@link EventExecutor} thread.
 *
 * <h2>Architectural Role</h2>
 * This is the single logical scheduler model: all operations spawned through
 * this scheduler are interleaved on one thread and never touch shared state
 * in parallel. It is the natural choice when services are driven from the
 * same event loop as the protocol stack they belong to.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code EventExecutor}, {@code Future}) MUST NOT escape
 * this package. Callers see only {@link Cancellable}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #NettyEventLoopScheduler(String, MonotonicClock)} creates and
 *       owns a {@link DefaultEventExecutor}; {@link #shutdown(Duration)} releases it.</li>
 *   <li>{@link #NettyEventLoopScheduler(EventExecutor, MonotonicClock)} wraps a
 *       caller-owned executor; {@link #shutdown(Duration)} leaves it alone.</li>
 * </ul>
 *
 * <p>A blocking operation occupies the event loop until it returns. Operations
 * that wait on a {@code DataEvent} should use a thread-pool scheduler instead.</p>
 */
public final class NettyEventLoopScheduler implements OperationScheduler
{
    private final EventExecutor executor;
    private final MonotonicClock clock;
    private final boolean ownsExecutor;

    public NettyEventLoopScheduler(String threadName, MonotonicClock clock)
    {
        this(new DefaultEventExecutor(new DefaultThreadFactory(Objects.requireNonNull(threadName, "threadName"))),
                clock, true);
    }

    public NettyEventLoopScheduler(EventExecutor executor, MonotonicClock clock)
    {
        this(executor, clock, false);
    }

    private NettyEventLoopScheduler(EventExecutor executor, MonotonicClock clock, boolean ownsExecutor)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public Cancellable submit(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        return new NettyFutureCancellable(executor.submit(task));
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        return new NettyFutureCancellable(executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS));
    }

    /**
     * @return {@code true} when called from the event-loop thread
     */
    public boolean inEventLoop()
    {
        return executor.inEventLoop();
    }

    /**
     * Shuts down the event loop if this scheduler created it and waits up to
     * {@code timeout} for the operation currently on the loop, and any
     * already queued, to finish. Running operations are not interrupted.
     *
     * @return {@code false} if the event loop was still running when the
     *         timeout expired; {@code true} otherwise, including when the
     *         executor is caller-owned
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (!ownsExecutor) {
            return true;
        }

        long timeoutNanos = timeout.toNanos();
        Future<?> termination = executor.shutdownGracefully(0, timeoutNanos, TimeUnit.NANOSECONDS);
        return termination.await(timeoutNanos, TimeUnit.NANOSECONDS);
    }

    private static final class NettyFutureCancellable implements Cancellable
    {
        private final Future<?> future;

        private NettyFutureCancellable(Future<?> future)
        {
            this.future = future;
        }

        @Override
        public boolean cancel()
        {
            return future.cancel(false);
        }
    }
}
