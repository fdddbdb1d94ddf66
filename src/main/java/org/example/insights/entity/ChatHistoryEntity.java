package org.example.insights.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "chat_histories", indexes = @Index(name = "idx_chat_histories_chat_sent", columnList = "chat_id, sent_at"))
public class ChatHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Column(length = 255)
    private String chatTitle;

    @Column(nullable = false)
    private Integer messageId;

    @Column
    private Long userId;

    @Column(length = 255)
    private String fullName;

    @Column(columnDefinition = "TEXT")
    private String text;

    @Column
    private Integer replyToMessageId;

    @Column(name = "sent_at", nullable = false)
    private LocalDateTime sentAt;

    public ChatHistoryEntity() {
    }

    public ChatHistoryEntity(Long chatId, Integer messageId, Long userId, String fullName, String text, LocalDateTime sentAt) {
        this.chatId = chatId;
        this.messageId = messageId;
        this.userId = userId;
        this.fullName = fullName;
        this.text = text;
        this.sentAt = sentAt;
    }

    public String getId() {
        return id;
    }

    public Long getChatId() {
        return chatId;
    }

    public String getChatTitle() {
        return chatTitle;
    }

    public void setChatTitle(String chatTitle) {
        this.chatTitle = chatTitle;
    }

    public Integer getMessageId() {
        return messageId;
    }

    public Long getUserId() {
        return userId;
    }

    public String getFullName() {
        return fullName;
    }

    public String getText() {
        return text;
    }

    public Integer getReplyToMessageId() {
        return replyToMessageId;
    }

    public void setReplyToMessageId(Integer replyToMessageId) {
        this.replyToMessageId = replyToMessageId;
    }

    public LocalDateTime getSentAt() {
        return sentAt;
    }
}
