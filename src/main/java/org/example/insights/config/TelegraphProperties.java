package org.example.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "telegraph")
public class TelegraphProperties {

    private String apiUrl = "https://api.telegra.ph";
    private String accessToken;
    private String authorName = "Insights Bot";
    private int timeoutSeconds = 30;
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    /**
     * Minimum spacing between consecutive create/edit calls of one page series.
     * Bursts get the access token invalidated.
     */
    private Duration pageCreateInterval = Duration.ofSeconds(2);
    /**
     * Working budget for serialized page content, below the 64 KiB platform ceiling.
     */
    private int pageSizeLimit = 60 * 1024;
    private int safetyBuffer = 2 * 1024;

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getAuthorName() {
        return authorName;
    }

    public void setAuthorName(String authorName) {
        this.authorName = authorName;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    public Duration getPageCreateInterval() {
        return pageCreateInterval;
    }

    public void setPageCreateInterval(Duration pageCreateInterval) {
        this.pageCreateInterval = pageCreateInterval == null ? Duration.ZERO : pageCreateInterval;
    }

    public int getPageSizeLimit() {
        return pageSizeLimit;
    }

    public void setPageSizeLimit(int pageSizeLimit) {
        this.pageSizeLimit = pageSizeLimit;
    }

    public int getSafetyBuffer() {
        return safetyBuffer;
    }

    public void setSafetyBuffer(int safetyBuffer) {
        this.safetyBuffer = safetyBuffer;
    }
}
