package com.questrail.supervision.event;

/**
 * Thrown by {@link DataEvent#peek()} when the event is not resolved.
 */
public final class EventNotResolvedException extends IllegalStateException
{
    public EventNotResolvedException(String message) {
        super(message);
    }
}
