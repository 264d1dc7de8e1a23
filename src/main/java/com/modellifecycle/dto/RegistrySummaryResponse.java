package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modellifecycle.entity.ModelState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class RegistrySummaryResponse {
    long totalVersions;
    String productionVersionId;
    String stagingVersionId;
    Map<ModelState, Long> countsByState;
    LatestVersion latestVersion;

    @Value
    @Builder
    public static class LatestVersion {
        String versionId;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant createdAt;
        ModelState state;
    }
}
