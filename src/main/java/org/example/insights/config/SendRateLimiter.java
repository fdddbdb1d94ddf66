package org.example.insights.config;

/**
 * Throughput guard shared by every outbound chat message.
 */
public interface SendRateLimiter {

    /**
     * Blocks until a send permit is available.
     */
    void acquire() throws InterruptedException;

    /**
     * Takes a permit if one is available right now.
     */
    boolean tryAcquire();
}
