package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of the whole catalog, oldest version first.
 */
@Value
@Builder
public class RegistryExportResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant exportedAt;
    String productionVersionId;
    String stagingVersionId;
    int totalVersions;
    List<ModelVersionResponse> versions;
}
