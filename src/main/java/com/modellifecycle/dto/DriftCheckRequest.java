package com.modellifecycle.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class DriftCheckRequest {

    String modelVersionId;

    @NotEmpty(message = "referenceSample must contain at least one feature")
    Map<String, List<Double>> referenceSample;

    @NotEmpty(message = "currentSample must contain at least one feature")
    Map<String, List<Double>> currentSample;

    @DecimalMin(value = "0.0", inclusive = false, message = "pValueThreshold must be > 0")
    @DecimalMax(value = "1.0", inclusive = false, message = "pValueThreshold must be < 1")
    Double pValueThreshold;
}
