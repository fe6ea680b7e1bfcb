package com.example.rental.dto;

import lombok.Builder;

/**
 * Provider-neutral view of one chat update: either a text/contact message or a button callback.
 */
@Builder
public record IncomingUpdate(long userId,
                             long chatId,
                             Integer messageId,
                             String username,
                             String firstName,
                             String lastName,
                             String languageCode,
                             String text,
                             String contactPhone,
                             String callbackId,
                             String callbackData) {

    public boolean isCallback() {
        return callbackData != null;
    }

    public String trimmedText() {
        return text == null ? "" : text.trim();
    }
}
