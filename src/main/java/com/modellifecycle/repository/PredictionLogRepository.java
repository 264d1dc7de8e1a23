package com.modellifecycle.repository;

import com.modellifecycle.entity.PredictionLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PredictionLogRepository extends JpaRepository<PredictionLogEntry, UUID> {

    @Query("""
        SELECT p FROM PredictionLogEntry p
        WHERE p.actualOutcome IS NOT NULL
          AND p.createdAt >= :since
          AND (:modelVersionId IS NULL OR p.modelVersionId = :modelVersionId)
        ORDER BY p.createdAt ASC
    """)
    List<PredictionLogEntry> findLabeledSince(
        @Param("since") Instant since,
        @Param("modelVersionId") String modelVersionId);

    @Query("""
        SELECT COUNT(p) FROM PredictionLogEntry p
        WHERE p.actualOutcome IS NOT NULL
          AND p.createdAt >= :since
    """)
    long countLabeledSince(@Param("since") Instant since);

    long countByActualOutcomeIsNotNull();

    @Query("""
        SELECT p FROM PredictionLogEntry p
        WHERE p.createdAt >= :from
          AND p.createdAt < :to
          AND (:modelVersionId IS NULL OR p.modelVersionId = :modelVersionId)
        ORDER BY p.createdAt ASC
    """)
    List<PredictionLogEntry> findWindow(
        @Param("from") Instant from,
        @Param("to") Instant to,
        @Param("modelVersionId") String modelVersionId);

    List<PredictionLogEntry> findAllByOrderByCreatedAtDesc(Pageable pageable);

    // precondition write: only lands while no outcome is stored
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PredictionLogEntry p
        SET p.actualOutcome = :outcome, p.outcomeUpdatedAt = :at
        WHERE p.id = :id AND p.actualOutcome IS NULL
    """)
    int recordOutcomeIfAbsent(
        @Param("id") UUID id,
        @Param("outcome") String outcome,
        @Param("at") Instant at);
}
