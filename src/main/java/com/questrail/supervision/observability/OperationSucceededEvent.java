package com.questrail.supervision.observability;

import java.time.Instant;

/**
 * Record describing a supervised operation whose result nobody consumed.
 */
public record OperationSucceededEvent(
    Instant timestamp,
    String operation,
    Object result
) {
}
