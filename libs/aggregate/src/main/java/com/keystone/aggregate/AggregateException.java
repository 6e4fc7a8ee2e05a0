package com.keystone.aggregate;

/**
 * Base class for errors raised by the aggregate root machinery itself.
 * <p>
 * All subclasses are unchecked: they signal a misconfigured aggregate class or a handler
 * failure, neither of which a caller can recover from by retrying the same call.
 */
public abstract class AggregateException extends RuntimeException {

    protected AggregateException(String message) {
        super(message);
    }

    protected AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
