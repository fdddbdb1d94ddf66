package org.example.insights.service;

public class InsufficientHistoryException extends RecapSkippedException {

    private final int messageCount;

    public InsufficientHistoryException(long chatId, int messageCount, int required) {
        super("Chat " + chatId + " has " + messageCount + " messages in the window, at least " + required + " required");
        this.messageCount = messageCount;
    }

    public int getMessageCount() {
        return messageCount;
    }
}
