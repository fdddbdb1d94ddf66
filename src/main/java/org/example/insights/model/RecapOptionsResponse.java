package org.example.insights.model;

import org.example.insights.entity.AutoRecapSendMode;
import org.example.insights.entity.RecapOptionsEntity;

import java.time.LocalDateTime;

public record RecapOptionsResponse(
        long chatId,
        String chatTitle,
        boolean enabled,
        AutoRecapSendMode sendMode,
        int ratesPerDay,
        boolean pinEnabled,
        int subscriberCount,
        LocalDateTime nextRecapAt
) {
    public static RecapOptionsResponse from(RecapOptionsEntity options, int subscriberCount, LocalDateTime nextRecapAt) {
        return new RecapOptionsResponse(
                options.getChatId(),
                options.getChatTitle(),
                options.isEnabled(),
                options.getSendMode(),
                options.effectiveRatesPerDay(),
                options.isPinEnabled(),
                subscriberCount,
                nextRecapAt
        );
    }
}
