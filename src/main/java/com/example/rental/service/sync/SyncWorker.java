package com.example.rental.service.sync;

import com.example.rental.config.SyncConfig;
import com.example.rental.model.SyncTask;
import com.example.rental.model.SyncTaskType;
import com.example.rental.service.BotMetrics;
import com.example.rental.service.exception.RemoteSinkException;
import com.example.rental.store.SyncQueueStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers the outbox to the mirror. One thread per task kind polls its due rows; rows of one
 * booking are serialised through a lock stripe and delivered in id order.
 */
@Slf4j
@Component
public class SyncWorker {

    private static final int GATE_STRIPES = 64;

    private final SyncQueueStore queue;
    private final SyncTaskProcessor processor;
    private final SyncConfig config;
    private final BotMetrics metrics;
    private final Clock clock;
    private final boolean enabled;

    private final ReentrantLock[] gates = new ReentrantLock[GATE_STRIPES];
    private final Map<SyncTaskType, ExecutorService> workers = new EnumMap<>(SyncTaskType.class);
    private volatile boolean running;

    public SyncWorker(SyncQueueStore queue, SyncTaskProcessor processor, SyncConfig config, BotMetrics metrics,
                      Clock clock, @Value("${sync.enabled:true}") boolean enabled) {
        this.queue = queue;
        this.processor = processor;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.enabled = enabled;
        for (int i = 0; i < GATE_STRIPES; i++) {
            gates[i] = new ReentrantLock();
        }
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Sync worker disabled");
            return;
        }
        running = true;
        for (SyncTaskType type : SyncTaskType.values()) {
            ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "sync-" + type.name().toLowerCase());
                t.setDaemon(true);
                return t;
            });
            workers.put(type, executor);
            executor.submit(() -> loop(type));
        }
        log.info("Sync worker started for {} task kinds", workers.size());
    }

    @PreDestroy
    public void stop() {
        running = false;
        workers.values().forEach(ExecutorService::shutdownNow);
        for (ExecutorService executor : workers.values()) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Sync worker thread did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.info("Sync worker stopped");
    }

    private void loop(SyncTaskType type) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                drain(type);
            } catch (Exception e) {
                log.error("Sync loop for {} failed: {}", type, e.getMessage(), e);
            }
            try {
                Thread.sleep(config.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Processes the due rows of one kind once.
     *
     * @return number of rows that reached a new status
     */
    public int drain(SyncTaskType type) {
        List<SyncTask> due = queue.leaseDuePendingTasks(type, config.getBatchSize(), LocalDateTime.now(clock));
        int handled = 0;
        for (SyncTask task : due) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (handle(task)) {
                handled++;
            }
        }
        return handled;
    }

    private boolean handle(SyncTask task) {
        ReentrantLock gate = gateFor(task);
        gate.lock();
        try {
            if (queue.hasEarlierOpenTask(task)) {
                log.debug("Task {} waits for an earlier task of booking {}", task.getId(), task.getBookingId());
                return false;
            }
            processor.process(task);
            queue.markCompleted(task.getId());
            metrics.syncOutcome(kind(task), "completed");
            log.debug("Task {} ({}) completed", task.getId(), kind(task));
            return true;
        } catch (RemoteSinkException e) {
            if (Thread.currentThread().isInterrupted()) {
                // shutdown: the row stays open and is picked up on next start
                log.info("Task {} interrupted, left for the next run", task.getId());
                return false;
            }
            if (!e.isRetryable()) {
                fail(task, e.getMessage());
            } else {
                retryOrFail(task, e.getMessage());
            }
            return true;
        } catch (IllegalArgumentException e) {
            fail(task, e.getMessage());
            return true;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Task {} interrupted, left for the next run", task.getId());
                return false;
            }
            retryOrFail(task, e.getMessage());
            return true;
        } finally {
            gate.unlock();
        }
    }

    private void retryOrFail(SyncTask task, String error) {
        int attempt = task.getRetryCount() + 1;
        if (attempt >= config.getMaxRetries()) {
            fail(task, error);
            return;
        }
        LocalDateTime next = LocalDateTime.now(clock).plus(config.retryDelay(attempt));
        queue.markRetry(task.getId(), next, error);
        metrics.syncOutcome(kind(task), "retry");
        log.warn("Task {} ({}) attempt {} failed, retry at {}: {}", task.getId(), kind(task), attempt, next, error);
    }

    private void fail(SyncTask task, String error) {
        queue.markFailed(task.getId(), error);
        metrics.syncOutcome(kind(task), "failed");
        log.error("Task {} ({}) for booking {} failed permanently: {}",
                task.getId(), kind(task), task.getBookingId(), error);
    }

    private ReentrantLock gateFor(SyncTask task) {
        long key = task.getBookingId() != null ? task.getBookingId() : task.getTaskType().ordinal();
        return gates[(int) Math.floorMod(key, (long) GATE_STRIPES)];
    }

    private static String kind(SyncTask task) {
        return task.getTaskType().name().toLowerCase();
    }
}
