package org.example.insights.repository;

import org.example.insights.entity.RecapOptionsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecapOptionsRepository extends JpaRepository<RecapOptionsEntity, Long> {

    List<RecapOptionsEntity> findByEnabledTrue();

    long countByEnabledTrue();
}
