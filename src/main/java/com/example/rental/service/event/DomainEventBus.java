package com.example.rental.service.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe. Handlers run synchronously on the publishing thread;
 * a failing handler is logged and does not stop delivery to the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainEventBus {

    private final ObjectMapper mapper;
    private final Clock clock;

    private final Map<EventType, List<DomainEventHandler>> subscribers = new ConcurrentHashMap<>();

    public void subscribe(EventType type, DomainEventHandler handler) {
        subscribers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void publish(DomainEvent event) {
        // CopyOnWriteArrayList iterates over a snapshot
        List<DomainEventHandler> handlers = subscribers.getOrDefault(event.type(), List.of());
        for (DomainEventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("Event handler failed for {}: {}", event.type().code(), e.getMessage(), e);
            }
        }
    }

    /** Encodes the payload as JSON and publishes it. Encoding failures are logged. */
    public void publishJson(EventType type, Object payload) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Cannot encode {} event payload: {}", type.code(), e.getMessage());
            return;
        }
        publish(new DomainEvent(type, json, LocalDateTime.now(clock)));
    }

    public <T> T decode(DomainEvent event, Class<T> type) throws JsonProcessingException {
        return mapper.readValue(event.payload(), type);
    }

    public int subscriberCount(EventType type) {
        return subscribers.getOrDefault(type, List.of()).size();
    }
}
