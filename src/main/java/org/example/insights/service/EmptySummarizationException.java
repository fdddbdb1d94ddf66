package org.example.insights.service;

public class EmptySummarizationException extends RecapSkippedException {

    public EmptySummarizationException(long chatId) {
        super("Summarization of chat " + chatId + " produced no usable topics");
    }
}
