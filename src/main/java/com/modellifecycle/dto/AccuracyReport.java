package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccuracyReport {
    int windowDays;
    String modelVersionId;
    long totalPredictions;
    long correctPredictions;
    double overallAccuracy;
    SortedMap<LocalDate, Double> dailyAccuracy;
    List<CalibrationBucket> calibration;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CalibrationBucket {
        String label;
        double lowerBound;
        double upperBound;
        long count;
        Double accuracy;
        Double meanConfidence;
    }
}
