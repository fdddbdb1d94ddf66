package org.example.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "recap.delivery")
public class DeliveryProperties {

    private int sendsPerSecond = 5;
    private int unsubscribeMaxAttempts = 5;
    private Duration unsubscribeRetryDelay = Duration.ofSeconds(10);

    public int getSendsPerSecond() {
        return sendsPerSecond;
    }

    public void setSendsPerSecond(int sendsPerSecond) {
        this.sendsPerSecond = sendsPerSecond;
    }

    public int getUnsubscribeMaxAttempts() {
        return unsubscribeMaxAttempts;
    }

    public void setUnsubscribeMaxAttempts(int unsubscribeMaxAttempts) {
        this.unsubscribeMaxAttempts = unsubscribeMaxAttempts;
    }

    public Duration getUnsubscribeRetryDelay() {
        return unsubscribeRetryDelay;
    }

    public void setUnsubscribeRetryDelay(Duration unsubscribeRetryDelay) {
        this.unsubscribeRetryDelay = unsubscribeRetryDelay == null ? Duration.ZERO : unsubscribeRetryDelay;
    }
}
