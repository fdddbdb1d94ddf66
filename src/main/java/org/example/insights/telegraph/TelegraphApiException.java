package org.example.insights.telegraph;

public class TelegraphApiException extends RuntimeException {

    public TelegraphApiException(String message) {
        super(message);
    }

    public TelegraphApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
