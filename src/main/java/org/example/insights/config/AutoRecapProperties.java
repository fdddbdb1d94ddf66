package org.example.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "recap.auto")
public class AutoRecapProperties {

    private boolean enabled = true;
    private int maxConcurrentRuns = 20;
    private int storeReadAttempts = 10;
    private Duration storeReadRetryDelay = Duration.ofMillis(500);
    private String zoneId = "UTC";
    private Long testChatId;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    public int getStoreReadAttempts() {
        return storeReadAttempts;
    }

    public void setStoreReadAttempts(int storeReadAttempts) {
        this.storeReadAttempts = storeReadAttempts;
    }

    public Duration getStoreReadRetryDelay() {
        return storeReadRetryDelay;
    }

    public void setStoreReadRetryDelay(Duration storeReadRetryDelay) {
        this.storeReadRetryDelay = storeReadRetryDelay == null ? Duration.ZERO : storeReadRetryDelay;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public Long getTestChatId() {
        return testChatId;
    }

    public void setTestChatId(Long testChatId) {
        this.testChatId = testChatId;
    }
}
