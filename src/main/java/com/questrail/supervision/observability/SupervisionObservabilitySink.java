package com.questrail.supervision.observability;

/**
 * Receives diagnostic records from supervised services and operation pools.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Implementations must not throw; they are called from completion paths
 * that have nowhere left to report an error to.</p>
 */
public interface SupervisionObservabilitySink {
    /**
     * Called when an operation failed and the failure was not handled elsewhere.
     * @param event the failure details
     */
    void onOperationFailed(OperationFailedEvent event);

    /**
     * Called when an operation produced a result that was not consumed elsewhere.
     * @param event the result details
     */
    void onOperationSucceeded(OperationSucceededEvent event);

    /**
     * Called when an operation was observed as cancelled.
     * @param event the cancellation details
     */
    void onOperationCancelled(OperationCancelledEvent event);

    /**
     * Called when a service is closed.
     * @param event the close details
     */
    void onServiceClosed(ServiceClosedEvent event);
}
