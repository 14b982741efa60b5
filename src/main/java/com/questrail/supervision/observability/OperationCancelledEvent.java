package com.questrail.supervision.observability;

import java.time.Instant;

/**
 * Record describing a supervised operation that ended by cancellation.
 * Cancellation is an expected outcome, not an error.
 */
public record OperationCancelledEvent(
    Instant timestamp,
    String operation
) {
}
