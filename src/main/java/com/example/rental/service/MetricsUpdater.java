package com.example.rental.service;

import com.example.rental.model.SyncTaskStatus;
import com.example.rental.store.SyncQueueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Refreshes the gauges that need a database query. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsUpdater {

    private final BotMetrics metrics;
    private final SyncQueueStore syncQueue;
    private final UserService userService;

    @Scheduled(fixedRate = 300_000, initialDelay = 10_000)
    public void refresh() {
        try {
            metrics.setSyncBacklog(syncQueue.countOpen(), syncQueue.countByStatus(SyncTaskStatus.FAILED));
            metrics.setActiveUsers(userService.activeUsers(30).size());
        } catch (Exception e) {
            log.warn("Metrics refresh failed: {}", e.getMessage());
        }
    }
}
