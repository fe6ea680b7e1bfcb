package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.IncomingUpdate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

/**
 * Long polling receiver. Updates are converted and handed over to {@link UpdateDispatcher}
 * right away so the polling thread never blocks on handlers.
 */
@Slf4j
@Component
public class TelegramBot extends TelegramLongPollingBot {

    private final BotConfig config;
    private final UpdateDispatcher dispatcher;
    private final TelegramChatSender chatSender;

    public TelegramBot(BotConfig config, UpdateDispatcher dispatcher, TelegramChatSender chatSender) {
        super(config.getToken());
        this.config = config;
        this.dispatcher = dispatcher;
        this.chatSender = chatSender;
    }

    @Override
    public String getBotUsername() {
        return config.getBotName();
    }

    @PostConstruct
    public void init() {
        chatSender.attach(this);
        log.info("RentalBot '{}' initialised", config.getBotName());
    }

    @Override
    public void onUpdateReceived(Update update) {
        IncomingUpdate incoming = toIncoming(update);
        if (incoming == null) {
            log.debug("Ignoring update {} without message or callback", update.getUpdateId());
            return;
        }
        dispatcher.submit(incoming);
    }

    static IncomingUpdate toIncoming(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery cbq = update.getCallbackQuery();
            MaybeInaccessibleMessage msg = cbq.getMessage();
            return withUser(IncomingUpdate.builder(), cbq.getFrom())
                    .chatId(msg != null ? msg.getChatId() : cbq.getFrom().getId())
                    .messageId(msg != null ? msg.getMessageId() : null)
                    .callbackId(cbq.getId())
                    .callbackData(cbq.getData() == null ? "" : cbq.getData())
                    .build();
        }
        if (update.hasMessage()) {
            Message msg = update.getMessage();
            if (msg.getFrom() == null) return null;
            if (!msg.hasText() && !msg.hasContact()) return null;
            return withUser(IncomingUpdate.builder(), msg.getFrom())
                    .chatId(msg.getChatId())
                    .messageId(msg.getMessageId())
                    .text(msg.getText())
                    .contactPhone(msg.hasContact() ? msg.getContact().getPhoneNumber() : null)
                    .build();
        }
        return null;
    }

    private static IncomingUpdate.IncomingUpdateBuilder withUser(IncomingUpdate.IncomingUpdateBuilder b, User from) {
        return b.userId(from.getId())
                .username(from.getUserName())
                .firstName(from.getFirstName())
                .lastName(from.getLastName())
                .languageCode(from.getLanguageCode());
    }
}
