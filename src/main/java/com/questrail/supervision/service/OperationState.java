package com.questrail.supervision.service;

/**
 * Lifecycle of a supervised operation.
 *
 * <pre>
 *   PENDING → RUNNING → SUCCEEDED | FAILED | CANCELLED
 *   PENDING → CANCELLED
 * </pre>
 */
public enum OperationState
{
    /** Scheduled, not started yet. */
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
