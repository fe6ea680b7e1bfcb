package com.example.rental.service;

import com.example.rental.config.BotConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class BotInitializer {

    private final BotConfig config;
    private final TelegramBot bot;

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        if (!config.isEnabled()) {
            log.info("bot.enabled=false, long polling is not started");
            return;
        }
        try {
            new TelegramBotsApi(DefaultBotSession.class).registerBot(bot);
            log.info("Bot '{}' registered for long polling", config.getBotName());
        } catch (TelegramApiException e) {
            log.error("Failed to register bot '{}': {}", config.getBotName(), e.getMessage(), e);
        }
    }
}
