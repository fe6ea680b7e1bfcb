package com.example.rental.dto;

import com.example.rental.model.ConversationStep;

import java.time.LocalDateTime;

public record ConversationState(long userId, ConversationStep step, ScratchData data, LocalDateTime updatedAt) {

    public static ConversationState initial(long userId) {
        return new ConversationState(userId, ConversationStep.MAIN_MENU, new ScratchData(), null);
    }

    /** Every key the current step relies on is present. */
    public boolean isConsistent() {
        return data.hasAll(step.requiredKeys());
    }
}
