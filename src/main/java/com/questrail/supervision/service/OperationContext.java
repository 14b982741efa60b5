package com.questrail.supervision.service;

import java.util.concurrent.CancellationException;

/**
 * View of its own handle that a running {@link Operation} receives.
 */
public interface OperationContext
{
    /**
     * @return the handle of the running operation
     */
    OperationHandle<?> handle();

    /**
     * @return whether cancellation has been requested for this operation
     */
    boolean isCancellationRequested();

    /**
     * Throws {@link CancellationException} if cancellation has been requested.
     * Operations that end this way are classified as cancelled.
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("operation " + handle() + " cancelled");
        }
    }
}
