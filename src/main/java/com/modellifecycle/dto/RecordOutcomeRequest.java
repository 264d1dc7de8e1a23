package com.modellifecycle.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RecordOutcomeRequest {
    @NotBlank(message = "actualOutcome is required")
    String actualOutcome;
}
