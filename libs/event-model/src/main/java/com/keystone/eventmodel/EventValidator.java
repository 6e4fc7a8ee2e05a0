package com.keystone.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that published events are complete and correctly sequenced before a persistence
 * collaborator writes them.
 *
 * <p>Both checks collect every error instead of stopping at the first one, so a caller can report
 * the whole problem in a single {@link ValidationResult}.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates that the metadata stamped at publish time is present.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(DomainEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        var errors = new ArrayList<String>();

        if (event.eventId() < 1) {
            errors.add("eventId must be >= 1");
        }
        if (event.aggregateRootId() == null) {
            errors.add("aggregateRootId must not be null");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Validates that {@code events} continue a stream whose last durable event id is
     * {@code lastCommittedEventId}: ids must run {@code last+1, last+2, ...} in list order.
     *
     * @param events pending events in the order they will be written
     * @param lastCommittedEventId id of the last event already persisted (0 for a new stream)
     * @return a {@link ValidationResult} naming each out-of-sequence position
     * @throws IllegalArgumentException if {@code events} is null or
     *     {@code lastCommittedEventId} is negative
     */
    public static ValidationResult validateSequence(
            List<? extends DomainEvent> events, long lastCommittedEventId) {
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        if (lastCommittedEventId < 0) {
            throw new IllegalArgumentException("lastCommittedEventId must be >= 0");
        }
        var errors = new ArrayList<String>();

        long expected = lastCommittedEventId + 1;
        for (int i = 0; i < events.size(); i++) {
            DomainEvent event = events.get(i);
            if (event == null) {
                errors.add("events[%d] must not be null".formatted(i));
            } else if (event.eventId() != expected) {
                errors.add("events[%d] has eventId %d, expected %d"
                        .formatted(i, event.eventId(), expected));
            }
            expected++;
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
