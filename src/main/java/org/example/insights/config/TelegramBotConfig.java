package org.example.insights.config;

import org.example.insights.telegram.TelegramRecapBot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/**
 * Starts long polling. Disabled with {@code telegram.enabled=false}, which leaves the bot usable for sending only.
 */
@Configuration
@ConditionalOnProperty(name = "telegram.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotConfig {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotConfig.class);

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean
    public InitializingBean registerRecapBot(TelegramBotsApi api, TelegramRecapBot bot, TelegramProperties properties) {
        return () -> {
            if (properties.getToken() == null || properties.getToken().isBlank()) {
                log.warn("telegram.token is not configured, long polling not started");
                return;
            }
            try {
                api.registerBot(bot);
                log.info("Registered Telegram bot {}", properties.getUsername());
            } catch (TelegramApiException e) {
                throw new IllegalStateException("Failed to register Telegram bot", e);
            }
        };
    }
}
