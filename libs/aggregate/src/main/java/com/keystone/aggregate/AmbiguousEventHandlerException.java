package com.keystone.aggregate;

import java.util.List;

/**
 * Thrown when an aggregate class declares more than one handler for the same event type and
 * neither overrides the other, e.g. a subclass redeclaring a handler that is {@code private}
 * in an ancestor.
 * <p>
 * Raised while the handler table is built, i.e. from the aggregate's constructor, never while
 * an event is being dispatched.
 */
public class AmbiguousEventHandlerException extends AggregateException {

    private final Class<?> aggregateType;
    private final Class<?> eventType;
    private final List<String> handlers;

    public AmbiguousEventHandlerException(Class<?> aggregateType, Class<?> eventType, List<String> handlers) {
        super("Aggregate %s declares %d handlers for event %s: %s"
                .formatted(aggregateType.getName(), handlers.size(), eventType.getName(), handlers));
        this.aggregateType = aggregateType;
        this.eventType = eventType;
        this.handlers = List.copyOf(handlers);
    }

    public Class<?> aggregateType() {
        return aggregateType;
    }

    public Class<?> eventType() {
        return eventType;
    }

    /** The conflicting handler signatures, most-derived first. */
    public List<String> handlers() {
        return handlers;
    }
}
