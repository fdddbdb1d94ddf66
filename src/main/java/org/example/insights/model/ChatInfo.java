package org.example.insights.model;

public record ChatInfo(
        long id,
        String type,
        String title
) {
    public boolean isSuperGroup() {
        return "supergroup".equals(type);
    }

    public boolean isPlainGroup() {
        return "group".equals(type);
    }
}
