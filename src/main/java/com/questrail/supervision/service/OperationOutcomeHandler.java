package com.questrail.supervision.service;

/**
 * OperationOutcomeHandler
 * -----------------------------------------------------------------------------
 * Receives the outcome of every supervised operation that did not end by
 * cancellation.
 *
 * <p>
 * Implementations are the last line of defence for failures nobody else
 * handled and MUST NOT throw. Anything they throw is logged and dropped by
 * the caller.
 * </p>
 *
 * @see DiagnosticOutcomeHandler the default implementation
 */
public interface OperationOutcomeHandler
{
    /**
     * Called once when {@code operation} terminated with {@code failure}.
     */
    void onOperationFailed(OperationHandle<?> operation, Throwable failure);

    /**
     * Called once when {@code operation} returned {@code result} (possibly {@code null}).
     */
    void onOperationSucceeded(OperationHandle<?> operation, Object result);
}
