package com.questrail.supervision.service;

import com.questrail.supervision.internal.time.SystemWallClock;
import com.questrail.supervision.internal.time.WallClock;
import com.questrail.supervision.observability.OperationFailedEvent;
import com.questrail.supervision.observability.OperationSucceededEvent;
import com.questrail.supervision.observability.SupervisionObservabilitySink;

import java.util.Objects;

/**
 * Default {@link OperationOutcomeHandler}: records failures and unconsumed
 * results as diagnostics on a {@link SupervisionObservabilitySink}.
 *
 * <p>With the SLF4J sink, failures are logged at ERROR with the stack trace
 * and results at INFO.</p>
 */
public final class DiagnosticOutcomeHandler implements OperationOutcomeHandler
{
    private final SupervisionObservabilitySink sink;
    private final WallClock wallClock;

    public DiagnosticOutcomeHandler(SupervisionObservabilitySink sink) {
        this(sink, SystemWallClock.INSTANCE);
    }

    public DiagnosticOutcomeHandler(SupervisionObservabilitySink sink, WallClock wallClock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void onOperationFailed(OperationHandle<?> operation, Throwable failure) {
        sink.onOperationFailed(new OperationFailedEvent(wallClock.now(), String.valueOf(operation), failure));
    }

    @Override
    public void onOperationSucceeded(OperationHandle<?> operation, Object result) {
        sink.onOperationSucceeded(new OperationSucceededEvent(wallClock.now(), String.valueOf(operation), result));
    }
}
