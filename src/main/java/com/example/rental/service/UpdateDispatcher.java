package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.IncomingUpdate;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each update on a bounded worker pool with a deadline. A failing handler is logged,
 * counted and the update dropped; the pool keeps going.
 */
@Slf4j
@Component
public class UpdateDispatcher {

    static final Duration UPDATE_DEADLINE = Duration.ofSeconds(30);

    private final ChatOrchestrator orchestrator;
    private final BotMetrics metrics;
    private final ThreadPoolExecutor pool;
    private final ScheduledExecutorService watchdog;

    public UpdateDispatcher(ChatOrchestrator orchestrator, BotMetrics metrics, BotConfig config) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        AtomicInteger counter = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(
                config.getUpdateWorkers(), config.getUpdateWorkers(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(config.getUpdateQueueCapacity(), 1)),
                r -> {
                    Thread t = new Thread(r, "update-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "update-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    public void submit(IncomingUpdate update) {
        Future<?> future;
        try {
            future = pool.submit(() -> process(update));
        } catch (RejectedExecutionException e) {
            log.warn("Update queue is full, dropping update from user {}", update.userId());
            metrics.updateDropped("queue_full");
            return;
        }
        watchdog.schedule(() -> {
            if (!future.isDone()) {
                log.warn("Update from user {} exceeded {}s, interrupting", update.userId(),
                        UPDATE_DEADLINE.toSeconds());
                future.cancel(true);
                metrics.updateDropped("deadline");
            }
        }, UPDATE_DEADLINE.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Handles one update on the calling thread. */
    void process(IncomingUpdate update) {
        MDC.put("request_id", UUID.randomUUID().toString().substring(0, 8));
        MDC.put("user_id", String.valueOf(update.userId()));
        long started = System.nanoTime();
        try {
            orchestrator.handle(update);
        } catch (Exception e) {
            log.error("Handler failed for update from user {}: {}", update.userId(), e.getMessage(), e);
            metrics.handlerError();
        } finally {
            metrics.updateProcessed(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            MDC.clear();
        }
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdown();
        watchdog.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
