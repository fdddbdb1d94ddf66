package org.example.insights.repository;

import org.example.insights.entity.RecapCapsuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecapCapsuleRepository extends JpaRepository<RecapCapsuleEntity, String> {

    Optional<RecapCapsuleEntity> findByChatId(Long chatId);

    boolean existsByChatId(Long chatId);

    @Query("""
            SELECT c.chatId
            FROM RecapCapsuleEntity c
            WHERE c.dueAt <= :now
              AND (c.leaseExpiresAt IS NULL OR c.leaseExpiresAt < :now)
            ORDER BY c.dueAt ASC
            """)
    List<Long> findDueChatIds(@Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE RecapCapsuleEntity c
            SET c.leaseOwner = :leaseOwner,
                c.leaseExpiresAt = :leaseExpiresAt
            WHERE c.chatId = :chatId
              AND c.dueAt <= :now
              AND (c.leaseExpiresAt IS NULL OR c.leaseExpiresAt < :now)
            """)
    int claimFireLease(
            @Param("chatId") Long chatId,
            @Param("now") LocalDateTime now,
            @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
            @Param("leaseOwner") String leaseOwner);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE RecapCapsuleEntity c
            SET c.dueAt = :dueAt,
                c.leaseOwner = NULL,
                c.leaseExpiresAt = NULL
            WHERE c.chatId = :chatId
            """)
    int rearm(@Param("chatId") Long chatId, @Param("dueAt") LocalDateTime dueAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM RecapCapsuleEntity c WHERE c.chatId = :chatId")
    int deleteByChatId(@Param("chatId") Long chatId);
}
