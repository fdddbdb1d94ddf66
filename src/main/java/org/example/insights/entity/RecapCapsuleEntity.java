package org.example.insights.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * A pending auto-recap fire for one chat. The lease columns mark a capsule that a poller has claimed.
 */
@Entity
@Table(name = "recap_capsules")
public class RecapCapsuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_id", nullable = false, unique = true)
    private Long chatId;

    @Column(nullable = false)
    private LocalDateTime dueAt;

    @Column(length = 120)
    private String leaseOwner;

    @Column
    private LocalDateTime leaseExpiresAt;

    public RecapCapsuleEntity() {
    }

    public RecapCapsuleEntity(Long chatId, LocalDateTime dueAt) {
        this.chatId = chatId;
        this.dueAt = dueAt;
    }

    public String getId() {
        return id;
    }

    public Long getChatId() {
        return chatId;
    }

    public LocalDateTime getDueAt() {
        return dueAt;
    }

    public void setDueAt(LocalDateTime dueAt) {
        this.dueAt = dueAt;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public void setLeaseOwner(String leaseOwner) {
        this.leaseOwner = leaseOwner;
    }

    public LocalDateTime getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public void setLeaseExpiresAt(LocalDateTime leaseExpiresAt) {
        this.leaseExpiresAt = leaseExpiresAt;
    }
}
