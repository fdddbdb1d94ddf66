package org.example.insights.entity;

public enum AutoRecapSendMode {
    PUBLICLY,
    ONLY_PRIVATE_SUBSCRIPTIONS
}
