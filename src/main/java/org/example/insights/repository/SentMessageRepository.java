package org.example.insights.repository;

import org.example.insights.entity.SentMessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SentMessageRepository extends JpaRepository<SentMessageEntity, String> {

    List<SentMessageEntity> findByChatIdAndPinnedTrueOrderBySentAtDesc(Long chatId);

    List<SentMessageEntity> findByChatIdOrderBySentAtDesc(Long chatId);

    long countByChatIdAndPinnedTrue(Long chatId);
}
