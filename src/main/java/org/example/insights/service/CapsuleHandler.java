package org.example.insights.service;

/**
 * Receives claimed time capsules.
 */
@FunctionalInterface
public interface CapsuleHandler {

    void onFire(long chatId);
}
