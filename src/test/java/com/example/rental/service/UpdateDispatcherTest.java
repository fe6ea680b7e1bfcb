package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.IncomingUpdate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class UpdateDispatcherTest {

    private ChatOrchestrator orchestrator;
    private BotMetrics metrics;
    private UpdateDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        orchestrator = Mockito.mock(ChatOrchestrator.class);
        metrics = new BotMetrics(new SimpleMeterRegistry());
        BotConfig config = new BotConfig();
        config.setUpdateWorkers(2);
        dispatcher = new UpdateDispatcher(orchestrator, metrics, config);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private static IncomingUpdate update() {
        return IncomingUpdate.builder().userId(42L).chatId(42L).text("hi").build();
    }

    @Test
    void processTagsLogsWithTheUserAndClearsAfterwards() {
        AtomicReference<String> seen = new AtomicReference<>();
        doAnswer(inv -> {
            seen.set(MDC.get("user_id"));
            return null;
        }).when(orchestrator).handle(any());

        dispatcher.process(update());

        assertThat(seen.get()).isEqualTo("42");
        assertThat(MDC.get("user_id")).isNull();
        assertThat(MDC.get("request_id")).isNull();
    }

    @Test
    void handlerFailureIsCountedAndSwallowed() {
        doThrow(new IllegalStateException("boom")).when(orchestrator).handle(any());

        dispatcher.process(update());

        assertThat(metrics.count("rental.updates.errors")).isEqualTo(1.0);
    }

    @Test
    void submittedUpdatesRunOnTheWorkerPool() {
        dispatcher.submit(update());

        verify(orchestrator, timeout(2000)).handle(any());
    }
}
