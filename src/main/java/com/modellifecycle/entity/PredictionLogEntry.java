package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One served prediction. Written once at inference time; the only later mutation
 * is the write-once actual outcome.
 */
@Entity
@Table(
    name = "prediction_log",
    indexes = {
        @Index(name = "idx_pred_model",   columnList = "model_version_id"),
        @Index(name = "idx_pred_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_version_id", nullable = false, length = 64, updatable = false)
    private String modelVersionId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "prediction_features", joinColumns = @JoinColumn(name = "prediction_id"))
    @MapKeyColumn(name = "feature_name", length = 128)
    @Column(name = "feature_value")
    private Map<String, Double> features = new LinkedHashMap<>();

    @Column(nullable = false, length = 64, updatable = false)
    private String prediction;

    @Column(nullable = false, updatable = false)
    private double probability;

    @Column(nullable = false, updatable = false)
    private double confidence;

    @Column(name = "actual_outcome", length = 64)
    private String actualOutcome;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "outcome_updated_at")
    private Instant outcomeUpdatedAt;

    public boolean isCorrect() {
        return actualOutcome != null && actualOutcome.equals(prediction);
    }
}
