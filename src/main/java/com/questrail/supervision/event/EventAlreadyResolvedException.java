package com.questrail.supervision.event;

/**
 * Thrown when a producer tries to resolve a {@link DataEvent} whose current
 * cycle is already resolved, with either a value or a failure.
 */
public final class EventAlreadyResolvedException extends IllegalStateException
{
    public EventAlreadyResolvedException(String message) {
        super(message);
    }
}
