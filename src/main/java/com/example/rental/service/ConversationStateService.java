package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.ConversationState;
import com.example.rental.dto.RateLimitResult;
import com.example.rental.dto.ScratchData;
import com.example.rental.model.ConversationStep;
import com.example.rental.model.ScratchKeys;
import com.example.rental.store.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Per-user dialogue position and scratch data. A state is always written as a whole.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStateService {

    private final ConversationStore store;
    private final BotConfig config;

    /** Current state, {@code main_menu} with empty data when none is stored. */
    public ConversationState get(long userId) {
        return store.getState(userId).orElseGet(() -> ConversationState.initial(userId));
    }

    public ConversationState set(long userId, ConversationStep step, ScratchData data) {
        return store.setState(new ConversationState(userId, step, data, null));
    }

    /** Moves to {@code step} keeping the current scratch data plus the given change. */
    public ConversationState advance(ConversationState current, ConversationStep step, String key, Object value) {
        ScratchData data = current.data().copy();
        if (key != null) {
            data.put(key, value);
        }
        return set(current.userId(), step, data);
    }

    public void clear(long userId) {
        store.clearState(userId);
    }

    /** Goes to the preceding step; the scratch data stays so prompts can be re-filled. */
    public ConversationState back(ConversationState current) {
        ConversationStep previous = current.step().previous(current.data().getString(ScratchKeys.DATE_TYPE));
        if (previous == ConversationStep.MAIN_MENU) {
            clear(current.userId());
            return ConversationState.initial(current.userId());
        }
        return set(current.userId(), previous, current.data());
    }

    public RateLimitResult checkRateLimit(long userId) {
        RateLimitResult result = store.checkRateLimit(userId, config.getRateLimitMessages(),
                Duration.ofSeconds(config.getRateLimitWindow()));
        if (!result.allowed() && result.firstRejection()) {
            log.warn("User {} exceeded {} messages per {}s", userId,
                    config.getRateLimitMessages(), config.getRateLimitWindow());
        }
        return result;
    }
}
