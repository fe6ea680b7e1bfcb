package com.example.rental.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Data
public class SyncConfig {

    @Value("${sync.poll_interval_ms:1000}")
    long pollIntervalMs = 1000;

    @Value("${sync.batch_size:20}")
    int batchSize = 20;

    @Value("${sync.max_retries:5}")
    int maxRetries = 5;

    @Value("${sync.base_delay_ms:2000}")
    long baseDelayMs = 2000;

    @Value("${sync.max_delay_ms:60000}")
    long maxDelayMs = 60_000;

    /** Delay before the given attempt (1-based): base * 2^(attempt-1), capped. */
    public Duration retryDelay(int attempt) {
        long delay = baseDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, maxDelayMs));
    }
}
