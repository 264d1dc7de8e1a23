package com.modellifecycle.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RecordPredictionRequest {

    @NotBlank(message = "modelVersionId is required")
    String modelVersionId;

    Map<String, Double> features;

    @NotBlank(message = "prediction is required")
    String prediction;

    @DecimalMin(value = "0.0", message = "probability must be >= 0")
    @DecimalMax(value = "1.0", message = "probability must be <= 1")
    double probability;

    @DecimalMin(value = "0.0", message = "confidence must be >= 0")
    @DecimalMax(value = "1.0", message = "confidence must be <= 1")
    double confidence;
}
