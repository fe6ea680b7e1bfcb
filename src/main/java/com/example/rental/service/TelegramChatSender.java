package com.example.rental.service;

import com.example.rental.service.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.io.File;
import java.util.Optional;

@Slf4j
@Component
public class TelegramChatSender implements ChatSender {

    private volatile AbsSender bot;

    /** Called by the bot once it is constructed. */
    public void attach(AbsSender bot) {
        this.bot = bot;
    }

    @Override
    public Optional<Integer> sendText(long chatId, String text) {
        return send(chatId, text, null);
    }

    @Override
    public Optional<Integer> send(long chatId, String text, ReplyKeyboard keyboard) {
        SendMessage sm = new SendMessage(String.valueOf(chatId), text);
        if (keyboard != null) {
            sm.setReplyMarkup(keyboard);
        }
        try {
            Message sent = bot().execute(sm);
            return Optional.ofNullable(sent).map(Message::getMessageId);
        } catch (TelegramApiException | TransportException e) {
            log.warn("Failed to send message to chat {}: {}", chatId, describe(e));
            return Optional.empty();
        }
    }

    @Override
    public void editMessage(long chatId, int messageId, String text, InlineKeyboardMarkup keyboard) {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(String.valueOf(chatId));
        edit.setMessageId(messageId);
        edit.setText(text);
        edit.setReplyMarkup(keyboard);
        try {
            bot().execute(edit);
        } catch (TelegramApiException | TransportException e) {
            if (isNotModified(e)) {
                return;
            }
            log.warn("Failed to edit message {} in chat {}: {}, sending a new one", messageId, chatId, describe(e));
            send(chatId, text, keyboard);
        }
    }

    @Override
    public void answerCallback(String callbackId, String text) {
        if (callbackId == null) return;
        try {
            bot().execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackId)
                    .text(text)
                    .showAlert(false)
                    .build());
        } catch (TelegramApiException | TransportException e) {
            log.debug("Failed to answer callback {}: {}", callbackId, describe(e));
        }
    }

    @Override
    public void sendDocument(long chatId, File file, String caption) {
        SendDocument doc = new SendDocument(String.valueOf(chatId), new InputFile(file));
        doc.setCaption(caption);
        try {
            bot().execute(doc);
        } catch (TelegramApiException | TransportException e) {
            log.warn("Failed to send document {} to chat {}: {}", file.getName(), chatId, describe(e));
        }
    }

    private AbsSender bot() {
        AbsSender current = bot;
        if (current == null) {
            throw new TransportException("Telegram bot is not attached yet", null);
        }
        return current;
    }

    private static boolean isNotModified(Exception e) {
        return e instanceof TelegramApiRequestException req
                && req.getApiResponse() != null
                && req.getApiResponse().contains("message is not modified");
    }

    private static String describe(Exception e) {
        if (e instanceof TelegramApiRequestException req && req.getApiResponse() != null) {
            return req.getApiResponse();
        }
        return e.getMessage();
    }
}
