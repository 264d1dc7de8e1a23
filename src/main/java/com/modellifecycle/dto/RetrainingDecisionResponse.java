package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.entity.DecisionOutcome;
import com.modellifecycle.entity.MetricDelta;
import com.modellifecycle.entity.RetrainingDecision;
import com.modellifecycle.entity.RetrainingPhase;
import com.modellifecycle.entity.TriggerReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainingDecisionResponse {
    UUID decisionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant triggeredAt;
    TriggerReason triggerReason;
    String reason;
    String requestedBy;
    UUID driftReportId;
    boolean retrainingPerformed;
    String productionVersionId;
    String candidateVersionId;
    Map<String, Double> candidateMetrics;
    Map<String, MetricDeltaView> comparisonSummary;
    boolean promoted;
    DecisionOutcome outcome;
    RetrainingPhase finalPhase;
    String failureReason;

    @Value
    @Builder
    public static class MetricDeltaView {
        double productionValue;
        double candidateValue;
        double difference;
        double percentChange;
        boolean improved;
    }

    public static RetrainingDecisionResponse from(RetrainingDecision d) {
        Map<String, MetricDeltaView> comparison = new LinkedHashMap<>();
        d.getComparisonSummary().forEach((metric, delta) -> comparison.put(metric, view(delta)));
        return RetrainingDecisionResponse.builder()
            .decisionId(d.getId())
            .triggeredAt(d.getTriggeredAt())
            .triggerReason(d.getTriggerReason())
            .reason(d.getReason())
            .requestedBy(d.getRequestedBy())
            .driftReportId(d.getDriftReportId())
            .retrainingPerformed(d.isRetrainingPerformed())
            .productionVersionId(d.getProductionVersionId())
            .candidateVersionId(d.getCandidateVersionId())
            .candidateMetrics(new LinkedHashMap<>(d.getCandidateMetrics()))
            .comparisonSummary(comparison)
            .promoted(d.isPromoted())
            .outcome(d.getOutcome())
            .finalPhase(d.getFinalPhase())
            .failureReason(d.getFailureReason())
            .build();
    }

    private static MetricDeltaView view(MetricDelta delta) {
        return MetricDeltaView.builder()
            .productionValue(delta.getBaselineValue())
            .candidateValue(delta.getCandidateValue())
            .difference(delta.getDifference())
            .percentChange(delta.getPercentChange())
            .improved(delta.isImproved())
            .build();
    }
}
