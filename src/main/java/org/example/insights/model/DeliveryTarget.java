package org.example.insights.model;

public record DeliveryTarget(long chatId, Kind kind) {

    public enum Kind {
        GROUP_BROADCAST,
        PRIVATE_SUBSCRIBER
    }

    public static DeliveryTarget group(long chatId) {
        return new DeliveryTarget(chatId, Kind.GROUP_BROADCAST);
    }

    public static DeliveryTarget privateSubscriber(long userId) {
        return new DeliveryTarget(userId, Kind.PRIVATE_SUBSCRIBER);
    }

    public boolean isGroup() {
        return kind == Kind.GROUP_BROADCAST;
    }
}
