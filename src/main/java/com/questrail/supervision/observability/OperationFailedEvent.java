package com.questrail.supervision.observability;

import java.time.Instant;

/**
 * Record describing a supervised operation that terminated abnormally.
 *
 * @param operation identity of the operation (its handle's string form)
 */
public record OperationFailedEvent(
    Instant timestamp,
    String operation,
    Throwable failure
) {
}
