package com.example.rental.service;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;

import java.io.File;
import java.util.Optional;

/**
 * Outbound chat operations. Implementations log and swallow delivery failures.
 */
public interface ChatSender {

    /** @return id of the sent message, empty when delivery failed */
    Optional<Integer> sendText(long chatId, String text);

    /** Text with a reply keyboard or an inline keyboard. */
    Optional<Integer> send(long chatId, String text, ReplyKeyboard keyboard);

    void editMessage(long chatId, int messageId, String text, InlineKeyboardMarkup keyboard);

    void answerCallback(String callbackId, String text);

    void sendDocument(long chatId, File file, String caption);
}
