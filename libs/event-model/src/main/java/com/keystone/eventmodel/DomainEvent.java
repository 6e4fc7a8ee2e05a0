package com.keystone.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Base type for every domain event applied to, or produced by, an aggregate root.
 *
 * <p>Concrete events extend this class and add their own payload fields. The metadata held here
 * is left unset when an event is constructed and is stamped by the owning aggregate at publish
 * time:
 *
 * <ul>
 *   <li>{@code eventId}: position of the event in its aggregate's stream, starting at 1. Zero
 *       means "not yet published".
 *   <li>{@code aggregateRootId}: identity of the aggregate that published the event.
 *   <li>{@code occurredAt}: when the event was published.
 * </ul>
 *
 * <p>Events are compared by reference. Two events with identical payloads are still two
 * distinct entries in a stream.
 */
public abstract class DomainEvent {

    /** Value of {@link #eventId()} before the event has been published. */
    public static final long UNASSIGNED_EVENT_ID = 0L;

    private long eventId = UNASSIGNED_EVENT_ID;
    private UUID aggregateRootId;
    private Instant occurredAt;

    protected DomainEvent() {
    }

    /** Sequence number of this event within its aggregate's stream (0 when unassigned). */
    public long eventId() {
        return eventId;
    }

    /**
     * Sets the sequence number of this event.
     *
     * @param eventId the sequence number, 0 meaning unassigned
     * @throws IllegalArgumentException if {@code eventId} is negative
     */
    public void setEventId(long eventId) {
        if (eventId < 0) {
            throw new IllegalArgumentException("eventId must be >= 0 but was " + eventId);
        }
        this.eventId = eventId;
    }

    /** Returns true once a sequence number has been assigned. */
    public boolean hasEventId() {
        return eventId != UNASSIGNED_EVENT_ID;
    }

    public UUID aggregateRootId() {
        return aggregateRootId;
    }

    public void setAggregateRootId(UUID aggregateRootId) {
        this.aggregateRootId = aggregateRootId;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    @Override
    public String toString() {
        return "%s{eventId=%d, aggregateRootId=%s, occurredAt=%s}"
                .formatted(getClass().getSimpleName(), eventId, aggregateRootId, occurredAt);
    }
}
