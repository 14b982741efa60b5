package com.questrail.supervision.internal.exec;

import com.questrail.supervision.internal.time.Cancellable;
import com.questrail.supervision.service.Operation;
import com.questrail.supervision.service.OperationContext;
import com.questrail.supervision.service.OperationHandle;
import com.questrail.supervision.service.OperationState;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * SupervisedOperation
 * =============================================================================
 * The concrete {@link OperationHandle}: wraps an {@link Operation}, runs it
 * when its scheduler calls {@link #run()}, classifies how it ended, and
 * reports the terminal state exactly once.
 *
 * <h2>State machine</h2>
 * <pre>
 *   PENDING --run()----→ RUNNING --returns---------------------→ SUCCEEDED
 *                                --CancellationException-------→ CANCELLED
 *                                --InterruptedException after
 *                                  cancel()--------------------→ CANCELLED
 *                                --any other throwable---------→ FAILED
 *   PENDING --cancel()--→ CANCELLED (never runs)
 * </pre>
 * All transitions happen under one private lock, so the terminal state is
 * reached once even when {@link #cancel()} races with {@link #run()}.
 *
 * <h2>Completion order</h2>
 * <ol>
 *   <li>terminal state and result/failure are recorded</li>
 *   <li>the termination listener (the owning service or pool) runs</li>
 *   <li>{@link #completion()} completes</li>
 * </ol>
 * Callers waiting on {@link #completion()} therefore see the supervision
 * bookkeeping already done.
 *
 * <h2>Errors</h2>
 * An {@link Error} thrown by the operation is recorded as FAILED and then
 * rethrown on the scheduler thread.
 */
public final class SupervisedOperation<T> implements OperationHandle<T>, Runnable
{
    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final String name;
    private final Operation<T> operation;
    private final Consumer<? super SupervisedOperation<T>> terminationListener;
    private final CompletableFuture<T> completion = new CompletableFuture<>();
    private final OperationContext context = new Context();

    private final Object lock = new Object();

    // Guarded by lock.
    private OperationState state = OperationState.PENDING;
    private Thread runner;
    private T result;
    private Throwable failure;

    private volatile boolean cancellationRequested;
    private volatile Cancellable scheduledStart;

    /**
     * @param name                diagnostic name; {@code null} selects {@code "operation-<id>"}
     * @param operation           the work to run
     * @param terminationListener called once, on the thread that observed termination
     */
    public SupervisedOperation(String name,
                               Operation<T> operation,
                               Consumer<? super SupervisedOperation<T>> terminationListener)
    {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.terminationListener = Objects.requireNonNull(terminationListener, "terminationListener");
        this.id = IDS.incrementAndGet();
        this.name = name != null ? name : "operation-" + id;
    }

    /**
     * Remembers the scheduler handle for the pending start so that
     * {@link #cancel()} can withdraw it.
     */
    public void startScheduled(Cancellable start)
    {
        this.scheduledStart = Objects.requireNonNull(start, "start");
        if (isDone()) {
            // Cancelled before the scheduler handed back its handle.
            start.cancel();
        }
    }

    @Override
    public void run()
    {
        synchronized (lock) {
            if (state != OperationState.PENDING || cancellationRequested) {
                return;
            }
            state = OperationState.RUNNING;
            runner = Thread.currentThread();
        }

        T value = null;
        Throwable thrown = null;
        try {
            value = operation.run(context);
        } catch (Throwable t) {
            thrown = t;
        }

        synchronized (lock) {
            runner = null;
            // Drop an interrupt delivered by cancel() that the operation never consumed.
            Thread.interrupted();
        }

        if (thrown == null) {
            finish(OperationState.SUCCEEDED, value, null);
        } else if (isCancellation(thrown)) {
            finish(OperationState.CANCELLED, null, thrown);
        } else {
            finish(OperationState.FAILED, null, thrown);
            if (thrown instanceof Error error) {
                throw error;
            }
        }
    }

    @Override
    public boolean cancel()
    {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            cancellationRequested = true;
            if (state == OperationState.RUNNING) {
                if (runner != null) {
                    runner.interrupt();
                }
                return true;
            }
        }

        Cancellable start = scheduledStart;
        if (start != null) {
            start.cancel();
        }
        finish(OperationState.CANCELLED, null, null);
        return true;
    }

    @Override
    public long id()
    {
        return id;
    }

    @Override
    public String name()
    {
        return name;
    }

    @Override
    public OperationState state()
    {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public CompletionStage<T> completion()
    {
        return completion.minimalCompletionStage();
    }

    public boolean isCancellationRequested()
    {
        return cancellationRequested;
    }

    /**
     * @return the result; meaningful only in state SUCCEEDED
     */
    public T result()
    {
        synchronized (lock) {
            return result;
        }
    }

    /**
     * @return the failure; meaningful only in state FAILED
     */
    public Throwable failure()
    {
        synchronized (lock) {
            return failure;
        }
    }

    @Override
    public String toString()
    {
        return "SupervisedOperation[id=" + id + ", name=" + name + ", state=" + state() + "]";
    }

    private boolean isCancellation(Throwable thrown)
    {
        return thrown instanceof CancellationException
                || (thrown instanceof InterruptedException && cancellationRequested);
    }

    private void finish(OperationState terminal, T value, Throwable thrown)
    {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            state = terminal;
            result = value;
            failure = terminal == OperationState.FAILED ? thrown : null;
        }

        try {
            terminationListener.accept(this);
        } finally {
            switch (terminal) {
                case SUCCEEDED -> completion.complete(value);
                case FAILED -> completion.completeExceptionally(thrown);
                default -> completion.completeExceptionally(cancellationOf(thrown));
            }
        }
    }

    private CancellationException cancellationOf(Throwable thrown)
    {
        if (thrown instanceof CancellationException cancellation) {
            return cancellation;
        }
        CancellationException cancellation = new CancellationException("operation " + name + " cancelled");
        if (thrown != null) {
            cancellation.initCause(thrown);
        }
        return cancellation;
    }

    private final class Context implements OperationContext
    {
        @Override
        public OperationHandle<?> handle()
        {
            return SupervisedOperation.this;
        }

        @Override
        public boolean isCancellationRequested()
        {
            return cancellationRequested;
        }
    }
}
