package org.example.insights.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed delay between attempts.
 */
public final class Retries {

    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    /**
     * Runs {@code action} up to {@code maxAttempts} times, sleeping {@code delay} between failures.
     *
     * @throws RetriesExhaustedException carrying the last failure once every attempt failed
     * @throws InterruptedException      if the wait between attempts is interrupted
     */
    public static <T> T call(
            String description,
            int maxAttempts,
            Duration delay,
            Sleeper sleeper,
            Supplier<T> action) throws InterruptedException {
        return call(description, maxAttempts, delay, sleeper, action, e -> true);
    }

    /**
     * Like {@link #call(String, int, Duration, Sleeper, Supplier)}, but a failure rejected by
     * {@code retryable} is rethrown at once.
     */
    public static <T> T call(
            String description,
            int maxAttempts,
            Duration delay,
            Sleeper sleeper,
            Supplier<T> action,
            Predicate<RuntimeException> retryable) throws InterruptedException {
        int attempts = Math.max(1, maxAttempts);
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                lastError = e;
                log.warn("{} failed (attempt {}/{}): {}", description, attempt, attempts, e.getMessage());
                if (attempt < attempts && delay != null && !delay.isZero()) {
                    sleeper.sleep(delay.toMillis());
                }
            }
        }
        throw new RetriesExhaustedException(description + " failed after " + attempts + " attempts", attempts, lastError);
    }

    public static class RetriesExhaustedException extends RuntimeException {

        private final int attempts;

        public RetriesExhaustedException(String message, int attempts, Throwable cause) {
            super(message, cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
