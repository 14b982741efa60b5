package com.questrail.supervision.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Production implementation of SupervisionObservabilitySink that emits logs via SLF4J.
 *
 * <p>By default records go to this class's logger. Services pass their own
 * logger so that diagnostics are attributed to the concrete service class.</p>
 */
public final class Slf4jSupervisionObservabilitySink implements SupervisionObservabilitySink {
    public static final Slf4jSupervisionObservabilitySink INSTANCE = new Slf4jSupervisionObservabilitySink();

    private final Logger log;

    public Slf4jSupervisionObservabilitySink() {
        this(LoggerFactory.getLogger(Slf4jSupervisionObservabilitySink.class));
    }

    public Slf4jSupervisionObservabilitySink(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public static Slf4jSupervisionObservabilitySink forClass(Class<?> type) {
        return new Slf4jSupervisionObservabilitySink(LoggerFactory.getLogger(type));
    }

    @Override
    public void onOperationFailed(OperationFailedEvent event) {
        log.error("operation {} failed:", event.operation(), event.failure());
    }

    @Override
    public void onOperationSucceeded(OperationSucceededEvent event) {
        log.info("unhandled operation ({}) result: {}", event.operation(), event.result());
    }

    @Override
    public void onOperationCancelled(OperationCancelledEvent event) {
        log.debug("operation {} cancelled", event.operation());
    }

    @Override
    public void onServiceClosed(ServiceClosedEvent event) {
        log.debug("service {} closed, cancellation requested for {} operation(s)",
            event.service(), event.cancelledOperations());
    }
}
