package com.example.rental.service.event;

@FunctionalInterface
public interface DomainEventHandler {
    void handle(DomainEvent event) throws Exception;
}
