package com.example.rental.service.event;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DomainEventBusTest {

    private DomainEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new DomainEventBus(JsonMapper.builder().addModule(new JavaTimeModule()).build(),
                Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void failingHandlerDoesNotStopTheOthers() {
        List<String> seen = new ArrayList<>();
        bus.subscribe(EventType.BOOKING_CONFIRMED, e -> seen.add("first"));
        bus.subscribe(EventType.BOOKING_CONFIRMED, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(EventType.BOOKING_CONFIRMED, e -> seen.add("third"));

        bus.publish(new DomainEvent(EventType.BOOKING_CONFIRMED, "{}", null));

        assertThat(seen).containsExactly("first", "third");
    }

    @Test
    void eventsReachOnlyTheirSubscribers() {
        List<EventType> seen = new ArrayList<>();
        bus.subscribe(EventType.BOOKING_CANCELED, e -> seen.add(e.type()));

        bus.publish(new DomainEvent(EventType.BOOKING_CREATED, "{}", null));

        assertThat(seen).isEmpty();
        assertThat(bus.subscriberCount(EventType.BOOKING_CANCELED)).isEqualTo(1);
        assertThat(bus.subscriberCount(EventType.BOOKING_CREATED)).isZero();
    }

    @Test
    void jsonPayloadDecodesBack() throws Exception {
        List<BookingEventPayload> seen = new ArrayList<>();
        bus.subscribe(EventType.BOOKING_CREATED, e -> seen.add(bus.decode(e, BookingEventPayload.class)));
        BookingEventPayload payload = new BookingEventPayload(5L, 42L, "Анна", 1L, "Canon R6", "pending",
                LocalDate.of(2025, 6, 10), null, 0L, "Анна", 42L);

        bus.publishJson(EventType.BOOKING_CREATED, payload);

        assertThat(seen).containsExactly(payload);
    }
}
