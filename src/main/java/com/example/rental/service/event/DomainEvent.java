package com.example.rental.service.event;

import java.time.LocalDateTime;

/**
 * @param payload JSON encoded body
 */
public record DomainEvent(EventType type, String payload, LocalDateTime createdAt) {
}
