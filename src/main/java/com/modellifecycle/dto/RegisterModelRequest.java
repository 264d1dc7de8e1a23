package com.modellifecycle.dto;

import com.modellifecycle.entity.ModelType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RegisterModelRequest {

    @NotBlank(message = "versionId is required")
    @Pattern(regexp = "^[a-zA-Z0-9._-]{1,64}$",
             message = "versionId must match ^[a-zA-Z0-9._-]{1,64}$")
    String versionId;

    ModelType modelType;

    @NotBlank(message = "artifactLocation is required")
    String artifactLocation;

    @NotNull(message = "metrics are required")
    Map<String, Double> metrics;

    Map<String, String> metadata;
}
