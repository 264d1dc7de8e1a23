package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modellifecycle.entity.DriftReport;
import com.modellifecycle.entity.PsiLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class DriftReportResponse {
    UUID reportId;
    String modelVersionId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    @JsonProperty("pValueThreshold")
    double pValueThreshold;
    int analyzedFeatureCount;
    int driftedFeatureCount;
    boolean overallDriftDetected;
    double driftFraction;
    List<FeatureDrift> featureDrift;
    Map<String, String> skippedFeatures;

    @Value
    @Builder
    public static class FeatureDrift {
        String feature;
        double ksStatistic;
        @JsonProperty("pValue")
        double pValue;
        double populationStabilityIndex;
        PsiLevel psiLevel;
        int referenceCount;
        int currentCount;
        boolean driftDetected;
    }

    public static DriftReportResponse from(DriftReport report) {
        List<FeatureDrift> features = report.getPerFeatureScores().entrySet().stream()
            .map(e -> FeatureDrift.builder()
                .feature(e.getKey())
                .ksStatistic(e.getValue().getStatistic())
                .pValue(e.getValue().getPValue())
                .populationStabilityIndex(e.getValue().getPopulationStabilityIndex())
                .psiLevel(e.getValue().getPsiLevel())
                .referenceCount(e.getValue().getReferenceCount())
                .currentCount(e.getValue().getCurrentCount())
                .driftDetected(e.getValue().isDrifted())
                .build())
            .sorted(Comparator.comparing(FeatureDrift::getPopulationStabilityIndex).reversed())
            .toList();

        return DriftReportResponse.builder()
            .reportId(report.getId())
            .modelVersionId(report.getModelVersionId())
            .generatedAt(report.getGeneratedAt())
            .pValueThreshold(report.getPValueThreshold())
            .analyzedFeatureCount(report.getAnalyzedFeatureCount())
            .driftedFeatureCount(report.getDriftedFeatureCount())
            .overallDriftDetected(report.isOverallDriftDetected())
            .driftFraction(report.getDriftFraction())
            .featureDrift(features)
            .skippedFeatures(new LinkedHashMap<>(report.getSkippedFeatures()))
            .build();
    }
}
