package com.modellifecycle.dto;

import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class RetrainingRunRequest {
    boolean force;
    @Builder.Default
    boolean autoPromote = true;
    @Size(max = 256, message = "reason must be at most 256 characters")
    String reason;
    @Size(max = 128, message = "requestedBy must be at most 128 characters")
    String requestedBy;
    UUID driftReportId;
}
