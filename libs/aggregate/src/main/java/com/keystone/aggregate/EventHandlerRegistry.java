package com.keystone.aggregate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of {@link EventHandlerTable}s keyed by aggregate class and {@link HandlerConvention}.
 * <p>
 * Tables are built on first request and reused by every later instance of the same aggregate
 * class. The registry is safe for concurrent use; a table that fails to build is not cached, so
 * every construction of a misconfigured aggregate fails the same way.
 */
public final class EventHandlerRegistry {

    private static final EventHandlerRegistry SHARED = new EventHandlerRegistry();

    private final Map<Key, EventHandlerTable> tables = new ConcurrentHashMap<>();

    /** The process-wide registry used by aggregates that are not given one explicitly. */
    public static EventHandlerRegistry shared() {
        return SHARED;
    }

    /**
     * Returns the dispatch table for {@code aggregateType}, building it on first use.
     *
     * @param aggregateType the concrete aggregate class
     * @param convention    naming rule for handler methods
     * @throws AmbiguousEventHandlerException if the class declares conflicting handlers
     */
    public EventHandlerTable tableFor(Class<? extends AggregateRoot> aggregateType,
                                      HandlerConvention convention) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType must not be null");
        }
        if (convention == null) {
            throw new IllegalArgumentException("convention must not be null");
        }
        return tables.computeIfAbsent(new Key(aggregateType, convention),
                key -> EventHandlerTable.build(key.aggregateType(), key.convention()));
    }

    /** Returns true if a table for the pair has already been built. */
    public boolean isCached(Class<? extends AggregateRoot> aggregateType, HandlerConvention convention) {
        return tables.containsKey(new Key(aggregateType, convention));
    }

    /** Returns the number of cached tables. */
    public int size() {
        return tables.size();
    }

    private record Key(Class<? extends AggregateRoot> aggregateType, HandlerConvention convention) {
    }
}
