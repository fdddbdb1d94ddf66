package org.example.insights.service;

/**
 * Published when a chat's auto-recap switch or rate changes, so its capsule can be re-armed or cancelled.
 */
public record RecapScheduleChangedEvent(long chatId, boolean enabled) {
}
