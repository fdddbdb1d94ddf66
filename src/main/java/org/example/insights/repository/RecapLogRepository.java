package org.example.insights.repository;

import org.example.insights.entity.RecapLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecapLogRepository extends JpaRepository<RecapLogEntity, String> {

    List<RecapLogEntity> findByChatIdOrderByCreatedAtDesc(Long chatId);
}
