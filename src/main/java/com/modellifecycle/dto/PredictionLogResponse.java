package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modellifecycle.entity.PredictionLogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class PredictionLogResponse {
    UUID predictionId;
    String modelVersionId;
    Map<String, Double> features;
    String prediction;
    double probability;
    double confidence;
    String actualOutcome;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant outcomeUpdatedAt;

    public static PredictionLogResponse from(PredictionLogEntry e) {
        return PredictionLogResponse.builder()
            .predictionId(e.getId())
            .modelVersionId(e.getModelVersionId())
            .features(new LinkedHashMap<>(e.getFeatures()))
            .prediction(e.getPrediction())
            .probability(e.getProbability())
            .confidence(e.getConfidence())
            .actualOutcome(e.getActualOutcome())
            .createdAt(e.getCreatedAt())
            .outcomeUpdatedAt(e.getOutcomeUpdatedAt())
            .build();
    }
}
