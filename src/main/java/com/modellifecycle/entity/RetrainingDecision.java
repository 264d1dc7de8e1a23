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
    name = "retraining_decisions",
    indexes = @Index(name = "idx_decision_triggered", columnList = "triggered_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RetrainingDecision {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "decision_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_reason", nullable = false, length = 32)
    private TriggerReason triggerReason;

    @Column(name = "reason", length = 512)
    private String reason;

    @Column(name = "requested_by", length = 128)
    private String requestedBy;

    @Column(name = "drift_report_id")
    private UUID driftReportId;

    @Column(name = "retraining_performed", nullable = false)
    private boolean retrainingPerformed;

    @Column(name = "production_version_id", length = 64)
    private String productionVersionId;

    @Column(name = "candidate_version_id", length = 64)
    private String candidateVersionId;

    @Column(name = "candidate_artifact_location", length = 512)
    private String candidateArtifactLocation;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "decision_candidate_metrics", joinColumns = @JoinColumn(name = "decision_id"))
    @MapKeyColumn(name = "metric_name", length = 64)
    @Column(name = "metric_value")
    private Map<String, Double> candidateMetrics = new LinkedHashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "decision_comparison", joinColumns = @JoinColumn(name = "decision_id"))
    @MapKeyColumn(name = "metric_name", length = 64)
    private Map<String, MetricDelta> comparisonSummary = new LinkedHashMap<>();

    @Column(nullable = false)
    private boolean promoted;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DecisionOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "final_phase", nullable = false, length = 32)
    private RetrainingPhase finalPhase;

    @Column(name = "failure_reason", length = 1024)
    private String failureReason;
}
