package org.example.insights.service;

/**
 * A recap run that ends without output for an expected reason. Logged, never retried.
 */
public class RecapSkippedException extends RuntimeException {

    public RecapSkippedException(String message) {
        super(message);
    }
}
