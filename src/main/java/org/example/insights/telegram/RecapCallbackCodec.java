package org.example.insights.telegram;

import org.example.insights.entity.AutoRecapSendMode;
import org.example.insights.model.RecapConfigAction;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encodes {@link RecapConfigAction}s as Telegram callback data, {@code r:<type>|<chatId>|<fromId>|<value>}.
 * Telegram caps callback data at 64 bytes.
 */
public final class RecapCallbackCodec {

    public static final int MAX_CALLBACK_BYTES = 64;
    static final String PREFIX = "r:";

    private RecapCallbackCodec() {
    }

    public static String encode(RecapConfigAction action) {
        String encoded;
        if (action instanceof RecapConfigAction.Toggle toggle) {
            encoded = join("t", toggle, toggle.enabled() ? "1" : "0");
        } else if (action instanceof RecapConfigAction.AssignMode assignMode) {
            encoded = join("m", assignMode, String.valueOf(assignMode.mode().ordinal()));
        } else if (action instanceof RecapConfigAction.SelectRates selectRates) {
            encoded = join("r", selectRates, String.valueOf(selectRates.ratesPerDay()));
        } else if (action instanceof RecapConfigAction.TogglePin togglePin) {
            encoded = join("p", togglePin, togglePin.pinEnabled() ? "1" : "0");
        } else if (action instanceof RecapConfigAction.Complete complete) {
            encoded = join("c", complete, "");
        } else if (action instanceof RecapConfigAction.Unsubscribe unsubscribe) {
            encoded = join("u", unsubscribe, "");
        } else {
            throw new IllegalArgumentException("Unsupported recap action: " + action);
        }
        if (encoded.getBytes(StandardCharsets.UTF_8).length > MAX_CALLBACK_BYTES) {
            throw new IllegalArgumentException("Callback data exceeds " + MAX_CALLBACK_BYTES + " bytes: " + encoded);
        }
        return encoded;
    }

    /**
     * Decodes callback data. Returns empty for data that is not a well-formed recap action.
     */
    public static Optional<RecapConfigAction> decode(String data) {
        if (data == null || !data.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String[] parts = data.substring(PREFIX.length()).split("\\|", -1);
        if (parts.length != 4) {
            return Optional.empty();
        }
        try {
            long chatId = Long.parseLong(parts[1]);
            long fromId = Long.parseLong(parts[2]);
            String value = parts[3];
            return switch (parts[0]) {
                case "t" -> Optional.of(new RecapConfigAction.Toggle(chatId, fromId, "1".equals(value)));
                case "m" -> Optional.of(new RecapConfigAction.AssignMode(chatId, fromId, sendMode(value)));
                case "r" -> Optional.of(new RecapConfigAction.SelectRates(chatId, fromId, Integer.parseInt(value)));
                case "p" -> Optional.of(new RecapConfigAction.TogglePin(chatId, fromId, "1".equals(value)));
                case "c" -> Optional.of(new RecapConfigAction.Complete(chatId, fromId));
                case "u" -> Optional.of(new RecapConfigAction.Unsubscribe(chatId, fromId));
                default -> Optional.empty();
            };
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String join(String type, RecapConfigAction action, String value) {
        return PREFIX + type + "|" + action.chatId() + "|" + action.fromId() + "|" + value;
    }

    private static AutoRecapSendMode sendMode(String value) {
        AutoRecapSendMode[] modes = AutoRecapSendMode.values();
        int ordinal = Integer.parseInt(value);
        if (ordinal < 0 || ordinal >= modes.length) {
            throw new IllegalArgumentException("Unknown send mode " + value);
        }
        return modes[ordinal];
    }
}
