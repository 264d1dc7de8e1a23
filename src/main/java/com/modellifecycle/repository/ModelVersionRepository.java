package com.modellifecycle.repository;

import com.modellifecycle.entity.ModelState;
import com.modellifecycle.entity.ModelVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, String> {

    List<ModelVersion> findByStateOrderByCreatedAtDesc(ModelState state);

    List<ModelVersion> findAllByOrderByCreatedAtDesc();

    Optional<ModelVersion> findFirstByOrderByCreatedAtDesc();

    Optional<ModelVersion> findFirstByStateOrderByArchivedAtDesc(ModelState state);

    long countByState(ModelState state);

    boolean existsByArtifactLocationAndVersionIdNot(String artifactLocation, String versionId);

    @Query("SELECT m.state, COUNT(m) FROM ModelVersion m GROUP BY m.state")
    List<Object[]> countGroupedByState();
}
