package com.example.rental.store;

import com.example.rental.dto.ConversationState;
import com.example.rental.dto.RateLimitResult;
import com.example.rental.dto.ScratchData;
import com.example.rental.model.ConversationStep;
import com.example.rental.model.ScratchKeys;
import com.example.rental.model.UserState;
import com.example.rental.repository.RateLimitCounterRepository;
import com.example.rental.repository.UserStateRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ConversationStoreTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");

    @Autowired
    private UserStateRepository stateRepo;
    @Autowired
    private RateLimitCounterRepository rateRepo;
    @Autowired
    private PlatformTransactionManager txManager;

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    private ConversationStore storeAt(Instant instant) {
        return new ConversationStore(stateRepo, rateRepo, mapper, txManager, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void stateIsStoredAsAWhole() {
        ConversationStore store = storeAt(T0);
        ScratchData data = new ScratchData()
                .put(ScratchKeys.ITEM_ID, 3L)
                .put(ScratchKeys.DATES, List.of(LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 11)));
        store.setState(new ConversationState(7L, ConversationStep.MANAGER_WAITING_COMMENT, data, null));

        store.setState(new ConversationState(7L, ConversationStep.ENTER_NAME,
                new ScratchData().put(ScratchKeys.ITEM_ID, 4L), null));

        ConversationState loaded = store.getState(7L).orElseThrow();
        assertThat(loaded.step()).isEqualTo(ConversationStep.ENTER_NAME);
        assertThat(loaded.data().getLong(ScratchKeys.ITEM_ID)).isEqualTo(4L);
        assertThat(loaded.data().has(ScratchKeys.DATES)).isFalse();
    }

    @Test
    void datesSurviveTheJsonRoundTrip() {
        ConversationStore store = storeAt(T0);
        store.setState(new ConversationState(8L, ConversationStep.MANAGER_WAITING_COMMENT,
                new ScratchData().put(ScratchKeys.DATES, List.of(LocalDate.of(2025, 6, 10))), null));

        assertThat(store.getState(8L).orElseThrow().data().getDates(ScratchKeys.DATES))
                .containsExactly(LocalDate.of(2025, 6, 10));
    }

    @Test
    void corruptDataStartsOver() {
        stateRepo.save(new UserState(9L, "enter_name", "{not json", LocalDateTime.of(2025, 6, 1, 10, 0)));

        ConversationState state = storeAt(T0).getState(9L).orElseThrow();

        assertThat(state.data().asMap()).isEmpty();
        assertThat(state.isConsistent()).isFalse();
    }

    @Test
    void clearRemovesTheState() {
        ConversationStore store = storeAt(T0);
        store.setState(ConversationState.initial(10L));
        store.clearState(10L);
        store.clearState(10L);

        assertThat(store.getState(10L)).isEmpty();
    }

    @Test
    void rateLimitRejectsOverflowAndReportsFirstRejectionOnce() {
        ConversationStore store = storeAt(T0);
        for (int i = 0; i < 3; i++) {
            assertThat(store.checkRateLimit(11L, 3, Duration.ofSeconds(60)).allowed()).isTrue();
        }

        assertThat(store.checkRateLimit(11L, 3, Duration.ofSeconds(60))).isEqualTo(new RateLimitResult(false, true));
        assertThat(store.checkRateLimit(11L, 3, Duration.ofSeconds(60))).isEqualTo(new RateLimitResult(false, false));

        ConversationStore later = storeAt(T0.plusSeconds(61));
        assertThat(later.checkRateLimit(11L, 3, Duration.ofSeconds(60)).allowed()).isTrue();
    }

    @Test
    void rateLimitIsPerUser() {
        ConversationStore store = storeAt(T0);
        store.checkRateLimit(12L, 1, Duration.ofSeconds(60));

        assertThat(store.checkRateLimit(12L, 1, Duration.ofSeconds(60)).allowed()).isFalse();
        assertThat(store.checkRateLimit(13L, 1, Duration.ofSeconds(60)).allowed()).isTrue();
    }
}
