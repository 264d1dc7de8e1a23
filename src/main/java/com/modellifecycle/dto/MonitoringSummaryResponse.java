package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonitoringSummaryResponse {
    long totalPredictions;
    long predictionsWithOutcomes;
    Double recentAccuracy;
    long driftReports;
}
