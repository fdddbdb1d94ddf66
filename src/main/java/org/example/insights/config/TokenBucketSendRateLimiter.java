package org.example.insights.config;

import org.example.insights.service.Sleeper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Token bucket refilled continuously at {@code permitsPerSecond}, holding at most one second of burst.
 */
@Component
public class TokenBucketSendRateLimiter implements SendRateLimiter {

    private final int permitsPerSecond;
    private final Clock clock;
    private final Sleeper sleeper;

    private double availablePermits;
    private long lastRefillMillis;

    @Autowired
    public TokenBucketSendRateLimiter(@Value("${recap.delivery.sends-per-second:5}") int permitsPerSecond) {
        this(permitsPerSecond, Clock.systemUTC(), Sleeper.THREAD_SLEEP);
    }

    TokenBucketSendRateLimiter(int permitsPerSecond, Clock clock, Sleeper sleeper) {
        this.permitsPerSecond = Math.max(1, permitsPerSecond);
        this.clock = clock;
        this.sleeper = sleeper;
        this.availablePermits = this.permitsPerSecond;
        this.lastRefillMillis = clock.millis();
    }

    @Override
    public void acquire() throws InterruptedException {
        while (true) {
            long waitMillis;
            synchronized (this) {
                refill();
                if (availablePermits >= 1) {
                    availablePermits -= 1;
                    return;
                }
                waitMillis = (long) Math.ceil((1 - availablePermits) * 1000.0 / permitsPerSecond);
            }
            sleeper.sleep(Math.max(1, waitMillis));
        }
    }

    @Override
    public synchronized boolean tryAcquire() {
        refill();
        if (availablePermits < 1) {
            return false;
        }
        availablePermits -= 1;
        return true;
    }

    public int getPermitsPerSecond() {
        return permitsPerSecond;
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        availablePermits = Math.min(permitsPerSecond, availablePermits + elapsed * permitsPerSecond / 1000.0);
        lastRefillMillis = now;
    }
}
