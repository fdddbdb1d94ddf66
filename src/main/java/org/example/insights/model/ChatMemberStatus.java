package org.example.insights.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum ChatMemberStatus {
    CREATOR,
    ADMINISTRATOR,
    MEMBER,
    RESTRICTED,
    LEFT,
    KICKED,
    UNKNOWN;

    private static final Set<ChatMemberStatus> RECAP_ELIGIBLE =
            EnumSet.of(CREATOR, ADMINISTRATOR, MEMBER, RESTRICTED);

    /**
     * Maps a Telegram status string ("creator", "administrator", "member", ...) to the enum.
     */
    public static ChatMemberStatus fromTelegram(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "creator" -> CREATOR;
            case "administrator" -> ADMINISTRATOR;
            case "member" -> MEMBER;
            case "restricted" -> RESTRICTED;
            case "left" -> LEFT;
            case "kicked" -> KICKED;
            default -> UNKNOWN;
        };
    }

    public boolean isRecapEligible() {
        return RECAP_ELIGIBLE.contains(this);
    }
}
