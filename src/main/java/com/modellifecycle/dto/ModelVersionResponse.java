package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.entity.ModelState;
import com.modellifecycle.entity.ModelType;
import com.modellifecycle.entity.ModelVersion;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelVersionResponse {
    String versionId;
    ModelType modelType;
    String artifactLocation;
    ModelState state;
    Map<String, Double> metrics;
    Map<String, String> metadata;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant stateChangedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant stagingAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant productionAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant archivedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant rolledBackAt;

    public static ModelVersionResponse from(ModelVersion v) {
        return ModelVersionResponse.builder()
            .versionId(v.getVersionId())
            .modelType(v.getModelType())
            .artifactLocation(v.getArtifactLocation())
            .state(v.getState())
            .metrics(new LinkedHashMap<>(v.getMetrics()))
            .metadata(new LinkedHashMap<>(v.getMetadata()))
            .createdAt(v.getCreatedAt())
            .stateChangedAt(v.getStateChangedAt())
            .stagingAt(v.getStagingAt())
            .productionAt(v.getProductionAt())
            .archivedAt(v.getArchivedAt())
            .rolledBackAt(v.getRolledBackAt())
            .build();
    }
}
