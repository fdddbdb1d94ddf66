package org.example.insights.repository;

import org.example.insights.entity.AutoRecapSubscriberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface AutoRecapSubscriberRepository extends JpaRepository<AutoRecapSubscriberEntity, String> {

    List<AutoRecapSubscriberEntity> findByChatIdOrderByCreatedAtAsc(Long chatId);

    boolean existsByChatIdAndUserId(Long chatId, Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM AutoRecapSubscriberEntity s WHERE s.chatId = :chatId AND s.userId = :userId")
    int deleteByChatIdAndUserId(@Param("chatId") Long chatId, @Param("userId") Long userId);
}
