package com.keystone.aggregate;

/**
 * Thrown when a handler method was found but the JVM refused to make it invocable
 * (for example a class in a named module that does not open its package).
 */
public class EventHandlerBindingException extends AggregateException {

    private final String handler;

    public EventHandlerBindingException(String handler, Throwable cause) {
        super("Cannot bind event handler " + handler, cause);
        this.handler = handler;
    }

    public String handler() {
        return handler;
    }
}
