package org.example.insights.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * A recap message sent by the bot. At most one row per chat carries {@code pinned = true}.
 */
@Entity
@Table(name = "sent_messages", indexes = @Index(name = "idx_sent_messages_chat_pinned", columnList = "chat_id, pinned"))
public class SentMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Column(nullable = false)
    private Integer messageId;

    @Column(columnDefinition = "TEXT")
    private String text;

    @Column(nullable = false)
    private boolean pinned;

    @Column(nullable = false)
    private LocalDateTime sentAt;

    public SentMessageEntity() {
    }

    public SentMessageEntity(Long chatId, Integer messageId, String text, boolean pinned) {
        this.chatId = chatId;
        this.messageId = messageId;
        this.text = text;
        this.pinned = pinned;
    }

    @PrePersist
    public void onCreate() {
        if (sentAt == null) {
            sentAt = LocalDateTime.now();
        }
    }

    public String getId() {
        return id;
    }

    public Long getChatId() {
        return chatId;
    }

    public Integer getMessageId() {
        return messageId;
    }

    public String getText() {
        return text;
    }

    public boolean isPinned() {
        return pinned;
    }

    public void setPinned(boolean pinned) {
        this.pinned = pinned;
    }

    public LocalDateTime getSentAt() {
        return sentAt;
    }
}
