package com.questrail.supervision.service;

import com.questrail.supervision.internal.time.Cancellable;

import java.util.concurrent.CompletionStage;

/**
 * OperationHandle
 * -----------------------------------------------------------------------------
 * Handle to one spawned {@link Operation}. Each handle corresponds to exactly
 * one operation and is unique for the lifetime of the process.
 *
 * <h2>Cancellation</h2>
 * {@link #cancel()} requests cancellation. A pending operation is cancelled
 * immediately and never runs. A running operation is asked to stop; how fast
 * it does so is up to the operation. An operation that observes the request
 * and returns normally still counts as succeeded.
 */
public interface OperationHandle<T> extends Cancellable
{
    /**
     * @return process-unique, monotonically assigned identifier
     */
    long id();

    /**
     * @return diagnostic name given at spawn time, or a generated one
     */
    String name();

    OperationState state();

    default boolean isDone() {
        return state().isTerminal();
    }

    /**
     * Stage completing with the operation's result, exceptionally with its
     * failure, or with a {@link java.util.concurrent.CancellationException}
     * when cancelled. Supervision bookkeeping for the operation is finished
     * before this stage completes.
     */
    CompletionStage<T> completion();
}
