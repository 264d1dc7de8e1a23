package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(
    name = "model_versions",
    indexes = {
        @Index(name = "idx_model_state",   columnList = "state"),
        @Index(name = "idx_model_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersion {

    @Id
    @Column(name = "version_id", length = 64, updatable = false, nullable = false)
    private String versionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "model_type", nullable = false, length = 32)
    private ModelType modelType;

    @Column(name = "artifact_location", nullable = false, length = 512)
    private String artifactLocation;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_metrics", joinColumns = @JoinColumn(name = "version_id"))
    @MapKeyColumn(name = "metric_name", length = 64)
    @Column(name = "metric_value")
    private Map<String, Double> metrics = new LinkedHashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_metadata", joinColumns = @JoinColumn(name = "version_id"))
    @MapKeyColumn(name = "meta_key", length = 128)
    @Column(name = "meta_value", length = 1024)
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ModelState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "state_changed_at", nullable = false)
    private Instant stateChangedAt;

    @Column(name = "staging_at")
    private Instant stagingAt;

    @Column(name = "production_at")
    private Instant productionAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "rolled_back_at")
    private Instant rolledBackAt;

    // optimistic concurrency guard on every state flip
    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public void transitionTo(ModelState target, Instant at) {
        this.state = target;
        this.stateChangedAt = at;
        switch (target) {
            case STAGING -> this.stagingAt = at;
            case PRODUCTION -> this.productionAt = at;
            case ARCHIVED -> this.archivedAt = at;
            default -> { }
        }
    }
}
