package com.keystone.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DomainEvent")
class DomainEventTest {

    private static final class SampleCreated extends DomainEvent {
    }

    @Test
    @DisplayName("new events carry no metadata")
    void unsetByDefault() {
        var event = new SampleCreated();

        assertThat(event.eventId()).isEqualTo(DomainEvent.UNASSIGNED_EVENT_ID);
        assertThat(event.hasEventId()).isFalse();
        assertThat(event.aggregateRootId()).isNull();
        assertThat(event.occurredAt()).isNull();
    }

    @Test
    @DisplayName("metadata is mutable")
    void settersStoreValues() {
        var event = new SampleCreated();
        var id = UUID.randomUUID();
        var at = Instant.parse("2024-01-02T03:04:05Z");

        event.setEventId(42);
        event.setAggregateRootId(id);
        event.setOccurredAt(at);

        assertThat(event.eventId()).isEqualTo(42);
        assertThat(event.hasEventId()).isTrue();
        assertThat(event.aggregateRootId()).isEqualTo(id);
        assertThat(event.occurredAt()).isEqualTo(at);
    }

    @Test
    @DisplayName("rejects a negative event id")
    void rejectsNegativeId() {
        var event = new SampleCreated();

        assertThatThrownBy(() -> event.setEventId(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
        assertThat(event.eventId()).isZero();
    }

    @Test
    @DisplayName("events are compared by reference")
    void referenceIdentity() {
        var first = new SampleCreated();
        var second = new SampleCreated();

        assertThat(first).isNotEqualTo(second);
        assertThat(first).isEqualTo(first);
    }

    @Test
    @DisplayName("toString names the concrete type and id")
    void describesItself() {
        var event = new SampleCreated();
        event.setEventId(7);

        assertThat(event.toString()).startsWith("SampleCreated{").contains("eventId=7");
    }
}
