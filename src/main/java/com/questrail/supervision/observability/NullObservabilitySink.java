package com.questrail.supervision.observability;

/**
 * No-op implementation of SupervisionObservabilitySink.
 */
public final class NullObservabilitySink implements SupervisionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onOperationFailed(OperationFailedEvent event) {}

    @Override
    public void onOperationSucceeded(OperationSucceededEvent event) {}

    @Override
    public void onOperationCancelled(OperationCancelledEvent event) {}

    @Override
    public void onServiceClosed(ServiceClosedEvent event) {}
}
