package org.example.insights.service;

public class TelegraphPublishingException extends RuntimeException {

    public TelegraphPublishingException(String message) {
        super(message);
    }

    public TelegraphPublishingException(String message, Throwable cause) {
        super(message, cause);
    }
}
