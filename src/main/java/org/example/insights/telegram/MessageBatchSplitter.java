package org.example.insights.telegram;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups consecutive text items into batches whose joined length stays within a message limit.
 * An item longer than the limit on its own forms a batch by itself.
 */
public final class MessageBatchSplitter {

    public static final int TELEGRAM_MESSAGE_LIMIT = 4096;
    public static final String SEPARATOR = "\n\n";

    private MessageBatchSplitter() {
    }

    public static List<List<String>> split(List<String> items, int limit) {
        List<List<String>> batches = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentLength = 0;
        for (String item : items) {
            if (item == null || item.isBlank()) {
                continue;
            }
            int added = current.isEmpty() ? item.length() : SEPARATOR.length() + item.length();
            if (!current.isEmpty() && currentLength + added > limit) {
                batches.add(current);
                current = new ArrayList<>();
                currentLength = 0;
                added = item.length();
            }
            current.add(item);
            currentLength += added;
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }
}
