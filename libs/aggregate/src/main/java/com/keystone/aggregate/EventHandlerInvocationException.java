package com.keystone.aggregate;

import com.keystone.eventmodel.DomainEvent;

/**
 * Wraps a checked exception thrown from inside an event handler body.
 * <p>
 * Unchecked exceptions and errors are never wrapped; they reach the caller of
 * {@code applyEvent}/{@code publishEvent} unchanged.
 */
public class EventHandlerInvocationException extends AggregateException {

    private final transient DomainEvent event;

    public EventHandlerInvocationException(String handler, DomainEvent event, Throwable cause) {
        super("Event handler %s failed for %s".formatted(handler, event), cause);
        this.event = event;
    }

    /** The event that was being applied when the handler failed. */
    public DomainEvent event() {
        return event;
    }
}
