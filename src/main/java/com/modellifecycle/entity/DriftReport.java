package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Immutable
@Table(
    name = "drift_reports",
    indexes = {
        @Index(name = "idx_drift_model",     columnList = "model_version_id"),
        @Index(name = "idx_drift_generated", columnList = "generated_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class DriftReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "report_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_version_id", length = 64)
    private String modelVersionId;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Column(name = "p_value_threshold", nullable = false)
    private double pValueThreshold;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drift_report_features", joinColumns = @JoinColumn(name = "report_id"))
    @MapKeyColumn(name = "feature_name", length = 128)
    private Map<String, FeatureDriftScore> perFeatureScores = new LinkedHashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drift_report_skipped", joinColumns = @JoinColumn(name = "report_id"))
    @MapKeyColumn(name = "feature_name", length = 128)
    @Column(name = "reason", length = 256)
    private Map<String, String> skippedFeatures = new LinkedHashMap<>();

    @Column(name = "analyzed_feature_count", nullable = false)
    private int analyzedFeatureCount;

    @Column(name = "drifted_feature_count", nullable = false)
    private int driftedFeatureCount;

    @Column(name = "overall_drift_detected", nullable = false)
    private boolean overallDriftDetected;

    @Column(name = "drift_fraction", nullable = false)
    private double driftFraction;
}
