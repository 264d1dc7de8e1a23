package com.modellifecycle.repository;

import com.modellifecycle.entity.RetrainingDecision;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface RetrainingDecisionRepository extends JpaRepository<RetrainingDecision, UUID> {

    List<RetrainingDecision> findAllByOrderByTriggeredAtDesc(Pageable pageable);

    List<RetrainingDecision> findByTriggeredAtGreaterThanEqualOrderByTriggeredAtDesc(Instant since);
}
