package com.keystone.aggregate;

/**
 * Naming rule that binds an event type to the aggregate method applying it.
 * <p>
 * A handler for event class {@code AccountOpened} under the default convention is a method
 * named {@code onAccountOpened} taking exactly one {@code AccountOpened} parameter. Nested event
 * classes use their simple name ({@code Account.Opened} maps to {@code onOpened}).
 *
 * @param prefix text placed before the event's simple class name
 */
public record HandlerConvention(String prefix) {

    /** The {@code on<EventName>} convention used by aggregates that do not choose one. */
    public static final HandlerConvention DEFAULT = new HandlerConvention("on");

    public HandlerConvention {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be null or blank");
        }
    }

    /**
     * Returns the handler method name expected for the given event type.
     *
     * @param eventType the concrete event class
     */
    public String handlerNameFor(Class<?> eventType) {
        return prefix + eventType.getSimpleName();
    }

    /** Returns true if {@code methodName} is the handler name for {@code eventType}. */
    public boolean matches(String methodName, Class<?> eventType) {
        return methodName.equals(handlerNameFor(eventType));
    }
}
