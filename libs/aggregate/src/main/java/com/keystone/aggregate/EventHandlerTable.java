package com.keystone.aggregate;

import com.keystone.eventmodel.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch table mapping each concrete event type to the single aggregate method that applies it.
 * <p>
 * A table is built once per aggregate class by introspecting the class and its ancestors up to
 * {@link AggregateRoot}, then the {@code default} methods of every interface those classes
 * implement. A method becomes a handler when all of the following hold:
 * <ul>
 *   <li>it is an instance method, not synthetic and not a bridge,</li>
 *   <li>it takes exactly one parameter, and that parameter is a {@link DomainEvent} subtype,</li>
 *   <li>its name is {@link HandlerConvention#handlerNameFor(Class)} of that parameter type.</li>
 * </ul>
 * Visibility is irrelevant: handlers are unreflected into {@link MethodHandle}s while the table
 * is built, so private and protected handlers are invoked like public ones. When a subclass
 * overrides an ancestor's handler only the most-derived declaration is bound; the handle still
 * dispatches virtually on the receiver. A class method always takes precedence over an interface
 * default with the same signature, and a sub-interface default over the one it overrides.
 * <p>
 * Lookup at dispatch time is a map lookup on the event's exact runtime class. Events whose class
 * has no handler are ignored.
 */
public final class EventHandlerTable {

    private static final Logger log = LoggerFactory.getLogger(EventHandlerTable.class);

    private static final MethodType DISPATCH_TYPE =
            MethodType.methodType(void.class, Object.class, DomainEvent.class);

    private final Class<?> aggregateType;
    private final Map<Class<?>, Binding> bindings;

    private EventHandlerTable(Class<?> aggregateType, Map<Class<?>, Binding> bindings) {
        this.aggregateType = aggregateType;
        this.bindings = Map.copyOf(bindings);
    }

    /**
     * Introspects {@code aggregateType} and builds its dispatch table.
     *
     * @param aggregateType the concrete aggregate class
     * @param convention    naming rule for handler methods
     * @return the immutable dispatch table
     * @throws AmbiguousEventHandlerException if two handlers for one event type do not override
     *                                        each other
     * @throws EventHandlerBindingException   if a handler cannot be made invocable
     */
    public static EventHandlerTable build(Class<? extends AggregateRoot> aggregateType,
                                          HandlerConvention convention) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType must not be null");
        }
        if (convention == null) {
            throw new IllegalArgumentException("convention must not be null");
        }

        // most-derived declarations are seen first
        Map<Class<?>, Method> selected = new LinkedHashMap<>();
        for (Class<?> type = aggregateType; type != null && type != AggregateRoot.class; type = type.getSuperclass()) {
            for (Method method : type.getDeclaredMethods()) {
                if (!isHandler(method, convention)) {
                    continue;
                }
                Class<?> eventType = method.getParameterTypes()[0];
                Method existing = selected.get(eventType);
                if (existing == null) {
                    selected.put(eventType, method);
                } else if (!overrides(existing, method)) {
                    throw new AmbiguousEventHandlerException(aggregateType, eventType,
                            List.of(describe(existing), describe(method)));
                }
            }
        }

        // a default is only bound when nothing more specific was found
        for (Class<?> contract : interfacesOf(aggregateType)) {
            for (Method method : contract.getDeclaredMethods()) {
                if (!method.isDefault() || !isHandler(method, convention)) {
                    continue;
                }
                Class<?> eventType = method.getParameterTypes()[0];
                Method existing = selected.get(eventType);
                if (existing == null || isMoreSpecificDefault(method, existing)) {
                    selected.put(eventType, method);
                }
            }
        }

        Map<Class<?>, Binding> bindings = new HashMap<>();
        for (Map.Entry<Class<?>, Method> entry : selected.entrySet()) {
            bindings.put(entry.getKey(), bind(entry.getValue()));
        }

        log.debug("Built event handler table for {} with {} handler(s)",
                aggregateType.getName(), bindings.size());
        return new EventHandlerTable(aggregateType, bindings);
    }

    /**
     * Applies {@code event} to {@code aggregate} through the handler bound to the event's exact
     * runtime class.
     * <p>
     * Unchecked exceptions and errors thrown by the handler propagate unchanged; checked ones are
     * wrapped in {@link EventHandlerInvocationException}.
     *
     * @return true if a handler was invoked, false if the event type has no handler
     */
    public boolean dispatch(AggregateRoot aggregate, DomainEvent event) {
        Binding binding = bindings.get(event.getClass());
        if (binding == null) {
            log.trace("No handler on {} for {}, ignoring", aggregateType.getSimpleName(),
                    event.getClass().getSimpleName());
            return false;
        }

        log.trace("Applying {} via {}", event, binding.signature());
        try {
            binding.handle().invokeExact((Object) aggregate, event);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new EventHandlerInvocationException(binding.signature(), event, t);
        }
        return true;
    }

    /** Returns true if events of exactly {@code eventType} have a handler. */
    public boolean handles(Class<? extends DomainEvent> eventType) {
        return bindings.containsKey(eventType);
    }

    /** The event types this table dispatches, in no particular order. */
    public Set<Class<?>> handledEventTypes() {
        return bindings.keySet();
    }

    /** The aggregate class this table was built for. */
    public Class<?> aggregateType() {
        return aggregateType;
    }

    private static boolean isHandler(Method method, HandlerConvention convention) {
        if (Modifier.isStatic(method.getModifiers()) || method.isSynthetic() || method.isBridge()) {
            return false;
        }
        if (method.getParameterCount() != 1) {
            return false;
        }
        Class<?> parameterType = method.getParameterTypes()[0];
        return DomainEvent.class.isAssignableFrom(parameterType)
                && convention.matches(method.getName(), parameterType);
    }

    /** All interfaces implemented by the classes below {@link AggregateRoot}, transitively. */
    private static Set<Class<?>> interfacesOf(Class<?> aggregateType) {
        Set<Class<?>> interfaces = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> type = aggregateType; type != null && type != AggregateRoot.class; type = type.getSuperclass()) {
            pending.addAll(List.of(type.getInterfaces()));
        }
        while (!pending.isEmpty()) {
            Class<?> contract = pending.removeFirst();
            if (interfaces.add(contract)) {
                pending.addAll(List.of(contract.getInterfaces()));
            }
        }
        return interfaces;
    }

    /** True if {@code candidate} is a default redeclared by a sub-interface of {@code existing}'s owner. */
    private static boolean isMoreSpecificDefault(Method candidate, Method existing) {
        Class<?> owner = existing.getDeclaringClass();
        return owner.isInterface()
                && owner != candidate.getDeclaringClass()
                && owner.isAssignableFrom(candidate.getDeclaringClass());
    }

    /** True if {@code derived} overrides {@code ancestor}; both share name and parameter type. */
    private static boolean overrides(Method derived, Method ancestor) {
        int modifiers = ancestor.getModifiers();
        if (Modifier.isPrivate(modifiers)) {
            return false;
        }
        if (Modifier.isPublic(modifiers) || Modifier.isProtected(modifiers)) {
            return true;
        }
        return derived.getDeclaringClass().getPackageName()
                .equals(ancestor.getDeclaringClass().getPackageName());
    }

    private static Binding bind(Method method) {
        String signature = describe(method);
        try {
            method.setAccessible(true);
            MethodHandle handle = MethodHandles.lookup().unreflect(method).asType(DISPATCH_TYPE);
            return new Binding(signature, handle);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new EventHandlerBindingException(signature, e);
        }
    }

    private static String describe(Method method) {
        return "%s.%s(%s)".formatted(method.getDeclaringClass().getName(), method.getName(),
                method.getParameterTypes()[0].getSimpleName());
    }

    private record Binding(String signature, MethodHandle handle) {
    }
}
