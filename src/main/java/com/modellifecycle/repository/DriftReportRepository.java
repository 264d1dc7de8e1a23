package com.modellifecycle.repository;

import com.modellifecycle.entity.DriftReport;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface DriftReportRepository extends JpaRepository<DriftReport, UUID> {

    @Query("""
        SELECT r FROM DriftReport r
        WHERE r.generatedAt >= :since
          AND (:modelVersionId IS NULL OR r.modelVersionId = :modelVersionId)
        ORDER BY r.generatedAt DESC
    """)
    List<DriftReport> findHistory(
        @Param("since") Instant since,
        @Param("modelVersionId") String modelVersionId);

    List<DriftReport> findAllByOrderByGeneratedAtDesc(Pageable pageable);
}
