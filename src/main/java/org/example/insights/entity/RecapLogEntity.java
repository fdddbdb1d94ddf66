package org.example.insights.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * One summarization run. The id travels with delivered messages so feedback can be attributed.
 */
@Entity
@Table(name = "recap_logs")
public class RecapLogEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private Long chatId;

    @Column(nullable = false)
    private int messageCount;

    @Column(length = 200)
    private String modelName;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(nullable = false)
    private int upVotes;

    @Column(nullable = false)
    private int downVotes;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public RecapLogEntity() {
    }

    public RecapLogEntity(String id, Long chatId, int messageCount, String modelName, String payloadJson) {
        this.id = id;
        this.chatId = chatId;
        this.messageCount = messageCount;
        this.modelName = modelName;
        this.payloadJson = payloadJson;
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public String getId() {
        return id;
    }

    public Long getChatId() {
        return chatId;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public String getModelName() {
        return modelName;
    }

    public String getPayloadJson() {
        return payloadJson;
    }

    public int getUpVotes() {
        return upVotes;
    }

    public int getDownVotes() {
        return downVotes;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
