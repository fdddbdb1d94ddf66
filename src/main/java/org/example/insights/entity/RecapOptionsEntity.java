package org.example.insights.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "recap_options")
public class RecapOptionsEntity {

    public static final int DEFAULT_RATES_PER_DAY = 4;

    @Id
    private Long chatId;

    @Column(nullable = false)
    private boolean enabled;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private AutoRecapSendMode sendMode;

    @Column(nullable = false)
    private int ratesPerDay;

    @Column(nullable = false)
    private boolean pinEnabled;

    @Column(length = 255)
    private String chatTitle;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public RecapOptionsEntity() {
    }

    public RecapOptionsEntity(Long chatId) {
        this.chatId = chatId;
        this.sendMode = AutoRecapSendMode.PUBLICLY;
        this.ratesPerDay = DEFAULT_RATES_PER_DAY;
    }

    @PrePersist
    @PreUpdate
    public void updateTimestamps() {
        updatedAt = LocalDateTime.now();
        if (sendMode == null) {
            sendMode = AutoRecapSendMode.PUBLICLY;
        }
    }

    /**
     * Rates per day with the stored zero mapped to the default.
     */
    public int effectiveRatesPerDay() {
        return ratesPerDay == 0 ? DEFAULT_RATES_PER_DAY : ratesPerDay;
    }

    public Long getChatId() {
        return chatId;
    }

    public void setChatId(Long chatId) {
        this.chatId = chatId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public AutoRecapSendMode getSendMode() {
        return sendMode;
    }

    public void setSendMode(AutoRecapSendMode sendMode) {
        this.sendMode = sendMode;
    }

    public int getRatesPerDay() {
        return ratesPerDay;
    }

    public void setRatesPerDay(int ratesPerDay) {
        this.ratesPerDay = ratesPerDay;
    }

    public boolean isPinEnabled() {
        return pinEnabled;
    }

    public void setPinEnabled(boolean pinEnabled) {
        this.pinEnabled = pinEnabled;
    }

    public String getChatTitle() {
        return chatTitle;
    }

    public void setChatTitle(String chatTitle) {
        this.chatTitle = chatTitle;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
