package com.modellifecycle.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class RetrainingCheckRequest {

    @DecimalMin(value = "0.0", message = "baselineAccuracy must be >= 0")
    @DecimalMax(value = "1.0", message = "baselineAccuracy must be <= 1")
    Double baselineAccuracy;

    @Min(value = 1, message = "minPredictions must be >= 1")
    Integer minPredictions;

    @DecimalMin(value = "0.0", message = "accuracyThreshold must be >= 0")
    Double accuracyThreshold;

    UUID driftReportId;

    @Size(max = 128, message = "requestedBy must be at most 128 characters")
    String requestedBy;
}
