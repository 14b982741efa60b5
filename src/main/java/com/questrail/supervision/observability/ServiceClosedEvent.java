package com.questrail.supervision.observability;

import java.time.Instant;

/**
 * Record emitted when a supervised service is closed.
 *
 * @param service             identity of the service
 * @param cancelledOperations number of operations a cancellation was requested for
 */
public record ServiceClosedEvent(
    Instant timestamp,
    String service,
    int cancelledOperations
) {
}
