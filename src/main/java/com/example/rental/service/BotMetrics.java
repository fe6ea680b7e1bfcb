package com.example.rental.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class BotMetrics {

    private final MeterRegistry registry;

    private final AtomicLong openSyncTasks = new AtomicLong();
    private final AtomicLong failedSyncTasks = new AtomicLong();
    private final AtomicLong activeUsers = new AtomicLong();

    public BotMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("rental.sync.tasks.open", openSyncTasks, AtomicLong::get)
                .description("Outbox rows waiting for delivery")
                .register(registry);
        Gauge.builder("rental.sync.tasks.failed", failedSyncTasks, AtomicLong::get)
                .description("Outbox rows that ran out of retries")
                .register(registry);
        Gauge.builder("rental.users.active", activeUsers, AtomicLong::get)
                .description("Users active in the last 30 days")
                .register(registry);
    }

    public void updateProcessed(long elapsedMs) {
        Timer.builder("rental.updates.duration")
                .register(registry)
                .record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void handlerError() {
        Counter.builder("rental.updates.errors").register(registry).increment();
    }

    public void updateDropped(String reason) {
        Counter.builder("rental.updates.dropped").tag("reason", reason).register(registry).increment();
    }

    public void bookingCreated(String source) {
        Counter.builder("rental.bookings.created").tag("source", source).register(registry).increment();
    }

    public void eventHandled(String type) {
        Counter.builder("rental.events.handled").tag("type", type).register(registry).increment();
    }

    public void syncOutcome(String kind, String outcome) {
        Counter.builder("rental.sync.tasks")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void setSyncBacklog(long open, long failed) {
        openSyncTasks.set(open);
        failedSyncTasks.set(failed);
    }

    public void setActiveUsers(long count) {
        activeUsers.set(count);
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }
}
