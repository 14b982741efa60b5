package com.questrail.supervision.service;

import com.questrail.supervision.internal.exec.SupervisedOperation;
import com.questrail.supervision.internal.time.MonotonicClock;
import com.questrail.supervision.internal.time.OperationScheduler;
import com.questrail.supervision.internal.time.SystemMonotonicClock;
import com.questrail.supervision.internal.time.SystemWallClock;
import com.questrail.supervision.internal.time.WallClock;
import com.questrail.supervision.observability.OperationCancelledEvent;
import com.questrail.supervision.observability.ServiceClosedEvent;
import com.questrail.supervision.observability.Slf4jSupervisionObservabilitySink;
import com.questrail.supervision.observability.SupervisionObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AbstractSupervisedService
 * -----------------------------------------------------------------------------
 * Base class for services bound to one owning session ("node") that run
 * background work.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Tracks every operation spawned via {@link #spawn(Operation)} until it
 *       terminates</li>
 *   <li>Observes each operation's termination exactly once and routes it:
 *       failures to {@link #onOperationFailed}, results to
 *       {@link #onOperationSucceeded}; cancellations are dropped</li>
 *   <li>Keeps failures of one operation away from every other operation and
 *       from the caller of {@code spawn}</li>
 *   <li>Cancels all outstanding work on {@link #close()} and detaches from
 *       the node for good</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * <ul>
 *   <li>Retry failed operations; code that wants a retry spawns again</li>
 *   <li>Wait for cancelled operations to unwind</li>
 *   <li>Interpret the node; it is only held and handed out</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * A service is created bound to a live node. {@link #close()} cancels every
 * tracked operation and clears the node; afterwards {@link #node()} is empty
 * and stays empty. Subclasses must not spawn work once closed. Doing so is
 * logged as a warning; the operation is still tracked and a further
 * {@code close()} cancels it.
 *
 * <h2>Threading model</h2>
 * The tracked set is a concurrent set and the node an atomic reference, so
 * the service is correct whether its scheduler is a single event loop or a
 * thread pool. Outcome hooks run on whichever thread observed termination:
 * the scheduler thread for operations that ran, the caller of
 * {@link OperationHandle#cancel()} or {@link #close()} for operations
 * cancelled before they started.
 *
 * @param <N> type of the owning node
 */
public abstract class AbstractSupervisedService<N>
{
    private static final Logger log = LoggerFactory.getLogger(AbstractSupervisedService.class);

    private final AtomicReference<N> node;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<SupervisedOperation<?>> tracked = ConcurrentHashMap.newKeySet();

    private final OperationScheduler scheduler;
    private final MonotonicClock clock;
    private final SupervisionObservabilitySink observabilitySink;
    private final OperationOutcomeHandler outcomeHandler;
    private final WallClock wallClock = SystemWallClock.INSTANCE;

    /**
     * Creates a service logging its diagnostics under the concrete class name.
     */
    protected AbstractSupervisedService(N node, OperationScheduler scheduler)
    {
        this(node, scheduler, null, null, null);
    }

    /**
     * @param node              owning node (must not be {@code null})
     * @param scheduler         scheduler running spawned operations
     * @param clock             clock for delayed spawns; {@code null} selects {@link SystemMonotonicClock}
     * @param observabilitySink diagnostics sink; {@code null} selects SLF4J under the concrete class name
     * @param outcomeHandler    default target of the outcome hooks; {@code null} selects a
     *                          {@link DiagnosticOutcomeHandler} on {@code observabilitySink}
     */
    protected AbstractSupervisedService(N node,
                                        OperationScheduler scheduler,
                                        MonotonicClock clock,
                                        SupervisionObservabilitySink observabilitySink,
                                        OperationOutcomeHandler outcomeHandler)
    {
        this.node = new AtomicReference<>(Objects.requireNonNull(node, "node"));
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNullElse(clock, SystemMonotonicClock.INSTANCE);
        this.observabilitySink = observabilitySink != null
                ? observabilitySink
                : Slf4jSupervisionObservabilitySink.forClass(getClass());
        this.outcomeHandler = outcomeHandler != null
                ? outcomeHandler
                : new DiagnosticOutcomeHandler(this.observabilitySink, wallClock);
    }

    /**
     * The node this service is bound to, or empty once the service is closed.
     */
    public final Optional<N> node()
    {
        return Optional.ofNullable(node.get());
    }

    public final boolean isClosed()
    {
        return closed.get();
    }

    /**
     * @return number of spawned operations that have not terminated yet
     */
    public final int trackedOperationCount()
    {
        return tracked.size();
    }

    /**
     * Spawns {@code operation} on this service's scheduler.
     *
     * <p>The handle is tracked before the operation is submitted, so even an
     * operation that completes immediately is observed as tracked first.</p>
     */
    protected final <T> OperationHandle<T> spawn(Operation<T> operation)
    {
        return spawn(null, operation);
    }

    /**
     * Spawns {@code operation} under a diagnostic name.
     */
    protected final <T> OperationHandle<T> spawn(String name, Operation<T> operation)
    {
        SupervisedOperation<T> handle = track(name, operation);
        try {
            handle.startScheduled(scheduler.submit(handle));
        } catch (RuntimeException e) {
            // A rejected submission must not stay tracked.
            handle.cancel();
            throw e;
        }
        return handle;
    }

    /**
     * Spawns {@code operation} to start after {@code delay}. Until it starts it
     * is tracked like any other operation and {@link #close()} cancels it
     * without it ever running.
     */
    protected final <T> OperationHandle<T> spawnAfter(Duration delay, Operation<T> operation)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        SupervisedOperation<T> handle = track(null, operation);
        try {
            handle.startScheduled(scheduler.scheduleAfter(delay, clock, handle));
        } catch (RuntimeException e) {
            handle.cancel();
            throw e;
        }
        return handle;
    }

    /**
     * Snapshot of the operations that have not terminated yet.
     */
    protected final Set<OperationHandle<?>> trackedOperations()
    {
        return Set.copyOf(tracked);
    }

    /**
     * Detaches the service from its node and requests cancellation of every
     * operation it spawned that has not terminated.
     *
     * <p>Does not wait for running operations to stop. Calling it again is
     * harmless.</p>
     */
    public void close()
    {
        List<SupervisedOperation<?>> outstanding = List.copyOf(tracked);

        int cancelled = 0;
        for (SupervisedOperation<?> operation : outstanding) {
            if (!operation.isDone() && operation.cancel()) {
                cancelled++;
            }
        }

        node.set(null);

        if (closed.compareAndSet(false, true)) {
            observabilitySink.onServiceClosed(new ServiceClosedEvent(wallClock.now(), toString(), cancelled));
        }
    }

    /**
     * Called once for each spawned operation that terminated with a failure.
     * <p>
     * The default implementation hands the failure to the configured
     * {@link OperationOutcomeHandler}, which by default records it at ERROR
     * level. Overrides must not throw.
     */
    protected void onOperationFailed(OperationHandle<?> operation, Throwable failure)
    {
        outcomeHandler.onOperationFailed(operation, failure);
    }

    /**
     * Called once for each spawned operation that returned normally.
     * <p>
     * The default implementation hands the result to the configured
     * {@link OperationOutcomeHandler}, which by default records it at INFO
     * level. Override it when the result is needed.
     */
    protected void onOperationSucceeded(OperationHandle<?> operation, Object result)
    {
        outcomeHandler.onOperationSucceeded(operation, result);
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "[node=" + node.get() + ", tracked=" + tracked.size() + "]";
    }

    private <T> SupervisedOperation<T> track(String name, Operation<T> operation)
    {
        SupervisedOperation<T> handle = new SupervisedOperation<>(name, operation, this::operationTerminated);
        if (closed.get()) {
            log.warn("{} spawning {} after close()", this, handle);
        }
        tracked.add(handle);
        return handle;
    }

    private void operationTerminated(SupervisedOperation<?> operation)
    {
        tracked.remove(operation);

        try {
            switch (operation.state()) {
                case CANCELLED -> observabilitySink.onOperationCancelled(
                        new OperationCancelledEvent(wallClock.now(), operation.toString()));
                case FAILED -> onOperationFailed(operation, operation.failure());
                case SUCCEEDED -> onOperationSucceeded(operation, operation.result());
                default -> throw new IllegalStateException("not terminal: " + operation);
            }
        } catch (RuntimeException e) {
            log.error("{} outcome handling for {} threw", this, operation, e);
        }
    }
}
