package org.example.insights.telegram;

import org.example.insights.config.TelegramProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Long-polling endpoint. Updates are republished as application events for {@link TelegramUpdateHandler}.
 */
@Component
public class TelegramRecapBot extends TelegramLongPollingBot {

    private static final Logger log = LoggerFactory.getLogger(TelegramRecapBot.class);

    private final TelegramProperties properties;
    private final ApplicationEventPublisher publisher;

    public TelegramRecapBot(TelegramProperties properties, ApplicationEventPublisher publisher) {
        super(properties.getToken() == null ? "" : properties.getToken());
        this.properties = properties;
        this.publisher = publisher;
    }

    @Override
    public String getBotUsername() {
        return properties.getUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }
}
