package com.modellifecycle.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DegradationResult {
    boolean degraded;
    double baselineAccuracy;
    double currentAccuracy;
    double accuracyDrop;
    double threshold;
    int windowDays;
    long totalPredictions;
}
