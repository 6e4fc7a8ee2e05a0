package com.keystone.aggregate;

import com.keystone.eventmodel.DomainEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for event-sourced aggregates.
 * <p>
 * State changes are expressed as {@link DomainEvent}s. A business method decides what happened
 * and calls {@link #publishEvent(DomainEvent)}, which numbers the event, buffers it as uncommitted
 * and applies it. Applying means invoking the subclass handler named after the event type, by
 * default {@code on<EventSimpleName>(EventType)}, whatever its visibility. Rebuilding from
 * history calls {@link #applyEvent(DomainEvent)} for each stored event instead, which runs the same
 * handlers without buffering.
 * <pre>{@code
 * public class Account extends AggregateRoot {
 *     private long balance;
 *
 *     public void deposit(long amount) {
 *         publishEvent(new FundsDeposited(amount));
 *     }
 *
 *     private void onFundsDeposited(FundsDeposited event) {
 *         balance += event.amount();
 *     }
 * }
 * }</pre>
 * The persistence collaborator reads {@link #uncommittedEvents()}, writes them durably, then
 * calls {@link #commitEvents()}.
 * <p>
 * Instances are not thread-safe. The owner must serialize access to one aggregate.
 */
public abstract class AggregateRoot {

    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();
    private final EventHandlerTable handlers;
    private final Clock clock;
    private UUID id;
    private long currentEventId;

    /**
     * Creates an empty aggregate using the default handler convention and the UTC system clock.
     *
     * @throws AmbiguousEventHandlerException if the subclass declares conflicting handlers
     */
    protected AggregateRoot() {
        this(EventHandlerRegistry.shared(), HandlerConvention.DEFAULT, Clock.systemUTC());
    }

    /**
     * Creates an empty aggregate that stamps events with times from {@code clock}.
     */
    protected AggregateRoot(Clock clock) {
        this(EventHandlerRegistry.shared(), HandlerConvention.DEFAULT, clock);
    }

    /**
     * Creates an empty aggregate resolving handlers with {@code convention}.
     */
    protected AggregateRoot(HandlerConvention convention) {
        this(EventHandlerRegistry.shared(), convention, Clock.systemUTC());
    }

    /**
     * Creates an empty aggregate.
     *
     * @param registry   cache of handler tables
     * @param convention naming rule for handler methods
     * @param clock      source of {@link DomainEvent#occurredAt()} timestamps
     * @throws AmbiguousEventHandlerException if the subclass declares conflicting handlers
     */
    protected AggregateRoot(EventHandlerRegistry registry, HandlerConvention convention, Clock clock) {
        this.handlers = Objects.requireNonNull(registry, "registry must not be null")
                .tableFor(getClass(), convention);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Applies an event to in-memory state through its handler.
     * <p>
     * The uncommitted buffer is never touched and the event id is never (re)assigned. When the event
     * carries an id beyond the sequence counter, as historical events do, the counter is moved to it
     * before the handler runs, so the next published event continues the stream. The counter never
     * moves backwards. Events without a handler are ignored.
     *
     * @param event the event to apply
     * @throws EventHandlerInvocationException if the handler throws a checked exception; unchecked
     *                                         exceptions propagate unchanged
     */
    public final void applyEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (event.eventId() > currentEventId) {
            currentEventId = event.eventId();
        }
        handlers.dispatch(this, event);
    }

    /**
     * Replays stored events in {@code eventId} order. The uncommitted buffer stays empty.
     *
     * @param history previously persisted events of this aggregate
     */
    public final void loadFromHistory(List<? extends DomainEvent> history) {
        Objects.requireNonNull(history, "history must not be null");
        history.stream()
                .sorted(Comparator.comparingLong(DomainEvent::eventId))
                .forEachOrdered(this::applyEvent);
    }

    /**
     * Records a newly produced event and applies it.
     * <p>
     * The event receives the next sequence number, this aggregate's id and the current time, is
     * appended to the uncommitted buffer as the same instance, and is then applied.
     *
     * @param event the new event
     */
    protected final void publishEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        event.setEventId(currentEventId + 1);
        currentEventId = event.eventId();
        event.setAggregateRootId(id);
        event.setOccurredAt(clock.instant());
        uncommittedEvents.add(event);
        applyEvent(event);
    }

    /**
     * Marks the uncommitted events as durably persisted by clearing the buffer.
     * The sequence counter is unchanged. Calling this with an empty buffer does nothing.
     */
    public final void commitEvents() {
        uncommittedEvents.clear();
    }

    /**
     * Events published since construction or the last {@link #commitEvents()}, in publish order.
     *
     * @return read-only live view of the buffer
     */
    public final List<DomainEvent> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /** Id of the last event published or replayed, 0 for a fresh aggregate. */
    public final long currentEventId() {
        return currentEventId;
    }

    public UUID id() {
        return id;
    }

    protected void setId(UUID id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return "%s{id=%s, currentEventId=%d, uncommitted=%d}"
                .formatted(getClass().getSimpleName(), id, currentEventId, uncommittedEvents.size());
    }
}
