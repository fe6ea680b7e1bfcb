package com.example.rental.store;

import com.example.rental.dto.ConversationState;
import com.example.rental.dto.RateLimitResult;
import com.example.rental.dto.ScratchData;
import com.example.rental.model.ConversationStep;
import com.example.rental.model.RateLimitCounter;
import com.example.rental.model.UserState;
import com.example.rental.repository.RateLimitCounterRepository;
import com.example.rental.repository.UserStateRepository;
import com.example.rental.service.exception.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Conversation scratch ({@code user_states}) and per-user rate limit counters
 * ({@code rate_limits}).
 */
@Slf4j
@Component
public class ConversationStore extends AbstractStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final UserStateRepository stateRepo;
    private final RateLimitCounterRepository rateRepo;
    private final ObjectMapper mapper;

    public ConversationStore(UserStateRepository stateRepo, RateLimitCounterRepository rateRepo,
                             ObjectMapper mapper, PlatformTransactionManager txManager, Clock clock) {
        super(txManager, clock);
        this.stateRepo = stateRepo;
        this.rateRepo = rateRepo;
        this.mapper = mapper;
    }

    public Optional<ConversationState> getState(long userId) {
        return read("getState", () -> stateRepo.findById(userId)).map(this::toState);
    }

    /** Replaces the whole state of the user. */
    public ConversationState setState(ConversationState state) {
        LocalDateTime now = now();
        UserState row = UserState.builder()
                .userId(state.userId())
                .step(state.step().code())
                .data(writeData(state.data()))
                .updatedAt(now)
                .build();
        write("setState", () -> stateRepo.save(row));
        return new ConversationState(state.userId(), state.step(), state.data().copy(), now);
    }

    public void clearState(long userId) {
        writeVoid("clearState", () -> {
            if (stateRepo.existsById(userId)) {
                stateRepo.deleteById(userId);
            }
        });
    }

    /**
     * Counts the attempt against the user's fixed window and tells whether it is allowed.
     * The row is locked for the read-modify-write.
     */
    public RateLimitResult checkRateLimit(long userId, int limit, Duration window) {
        try {
            return write("checkRateLimit", () -> advanceCounter(userId, limit, window));
        } catch (StorageException e) {
            if (!(e.getCause() instanceof DataIntegrityViolationException)) throw e;
            // two first attempts raced on the insert
            return write("checkRateLimit", () -> advanceCounter(userId, limit, window));
        }
    }

    private RateLimitResult advanceCounter(long userId, int limit, Duration window) {
        LocalDateTime now = now();
        RateLimitCounter counter = rateRepo.findForUpdate(userId).orElse(null);
        if (counter == null) {
            rateRepo.saveAndFlush(new RateLimitCounter(userId, now, 1));
            return new RateLimitResult(limit >= 1, limit < 1);
        }
        if (!now.isBefore(counter.getWindowStart().plus(window))) {
            counter.setWindowStart(now);
            counter.setCount(1);
        } else {
            counter.setCount(counter.getCount() + 1);
        }
        rateRepo.save(counter);
        int count = counter.getCount();
        return new RateLimitResult(count <= limit, count == limit + 1);
    }

    private ConversationState toState(UserState row) {
        return new ConversationState(row.getUserId(), ConversationStep.fromCode(row.getStep()),
                readData(row.getUserId(), row.getData()), row.getUpdatedAt());
    }

    private String writeData(ScratchData data) {
        try {
            return mapper.writeValueAsString(data.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise conversation data", e);
        }
    }

    private ScratchData readData(long userId, String json) {
        if (json == null || json.isBlank()) return new ScratchData();
        try {
            return new ScratchData(mapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Corrupted conversation data for user {}, starting over: {}", userId, e.getMessage());
            return new ScratchData();
        }
    }
}
