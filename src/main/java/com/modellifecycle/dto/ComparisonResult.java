package com.modellifecycle.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Metric-by-metric comparison of version B against version A. Only metrics present
 * in both versions appear.
 */
@Value
@Builder
public class ComparisonResult {
    String versionA;
    String versionB;
    Map<String, MetricComparison> metrics;

    public boolean improved(String metric) {
        MetricComparison c = metrics.get(metric);
        return c != null && c.isImproved();
    }

    @Value
    @Builder
    public static class MetricComparison {
        double valueA;
        double valueB;
        double difference;
        double percentChange;
        boolean improved;
    }
}
