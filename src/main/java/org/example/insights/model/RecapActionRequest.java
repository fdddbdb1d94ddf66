package org.example.insights.model;

import org.example.insights.entity.AutoRecapSendMode;

import java.util.Locale;

/**
 * JSON form of a {@link RecapConfigAction}. {@code type} is one of
 * toggle, assign-mode, select-rates, toggle-pin, complete, unsubscribe.
 */
public record RecapActionRequest(
        String type,
        Long fromId,
        Boolean enabled,
        String mode,
        Integer ratesPerDay,
        Boolean pinEnabled
) {
    public RecapConfigAction toAction(long chatId) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Action type is required");
        }
        long from = fromId == null ? 0L : fromId;
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "toggle" -> new RecapConfigAction.Toggle(chatId, from, require(enabled, "enabled"));
            case "assign-mode" -> new RecapConfigAction.AssignMode(chatId, from, sendMode());
            case "select-rates" -> new RecapConfigAction.SelectRates(chatId, from, require(ratesPerDay, "ratesPerDay"));
            case "toggle-pin" -> new RecapConfigAction.TogglePin(chatId, from, require(pinEnabled, "pinEnabled"));
            case "complete" -> new RecapConfigAction.Complete(chatId, from);
            case "unsubscribe" -> {
                if (fromId == null) {
                    throw new IllegalArgumentException("fromId is required to unsubscribe");
                }
                yield new RecapConfigAction.Unsubscribe(chatId, fromId);
            }
            default -> throw new IllegalArgumentException("Unknown action type: " + type);
        };
    }

    private AutoRecapSendMode sendMode() {
        if (mode == null || mode.isBlank()) {
            throw new IllegalArgumentException("mode is required");
        }
        return AutoRecapSendMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
