package org.example.insights.service.llm;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Exception thrown when an LLM provider encounters an error.
 * Transient failures (rate limits, server errors, timeouts, refused connections) may succeed on retry.
 */
public class LlmProviderException extends RuntimeException {

    private final boolean transientFailure;

    public LlmProviderException(String message) {
        this(message, null, false);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public LlmProviderException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Wraps a failed provider call, classifying it by HTTP status or transport error.
     */
    public static LlmProviderException fromCallFailure(String provider, Throwable failure) {
        if (failure instanceof WebClientResponseException e) {
            return new LlmProviderException(
                    provider + " API error: " + e.getStatusCode(), e, isTransientStatus(e.getStatusCode()));
        }
        if (failure instanceof WebClientRequestException || hasTimeoutCause(failure)) {
            return new LlmProviderException(provider + " request failed: " + failure.getMessage(), failure, true);
        }
        return new LlmProviderException("Failed to generate response from " + provider, failure, false);
    }

    static boolean isTransientStatus(HttpStatusCode status) {
        return status.value() == 429 || status.value() == 408 || status.is5xxServerError();
    }

    private static boolean hasTimeoutCause(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
