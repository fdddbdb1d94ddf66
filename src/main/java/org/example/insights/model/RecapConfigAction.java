package org.example.insights.model;

import org.example.insights.entity.AutoRecapSendMode;

/**
 * Configuration change requested from the recap settings keyboard or the REST surface.
 * Every action names the chat it applies to and the user who issued it.
 */
public sealed interface RecapConfigAction
        permits RecapConfigAction.Toggle, RecapConfigAction.AssignMode, RecapConfigAction.SelectRates,
        RecapConfigAction.TogglePin, RecapConfigAction.Complete, RecapConfigAction.Unsubscribe {

    long chatId();

    long fromId();

    record Toggle(long chatId, long fromId, boolean enabled) implements RecapConfigAction {
    }

    record AssignMode(long chatId, long fromId, AutoRecapSendMode mode) implements RecapConfigAction {
    }

    record SelectRates(long chatId, long fromId, int ratesPerDay) implements RecapConfigAction {
    }

    record TogglePin(long chatId, long fromId, boolean pinEnabled) implements RecapConfigAction {
    }

    record Complete(long chatId, long fromId) implements RecapConfigAction {
    }

    record Unsubscribe(long chatId, long fromId) implements RecapConfigAction {
    }
}
