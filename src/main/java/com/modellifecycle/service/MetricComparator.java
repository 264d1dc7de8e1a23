package com.modellifecycle.service;

import com.modellifecycle.dto.ComparisonResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Metric-by-metric comparison. Higher is better, except for loss-style metrics
 * ({@code loss} or any name ending in {@code _loss}) where lower is better.
 */
public final class MetricComparator {

    private MetricComparator() {
    }

    public static ComparisonResult compare(String versionA, Map<String, Double> metricsA,
                                           String versionB, Map<String, Double> metricsB) {
        Set<String> common = new TreeSet<>(metricsA.keySet());
        common.retainAll(metricsB.keySet());

        Map<String, ComparisonResult.MetricComparison> rows = new LinkedHashMap<>();
        for (String metric : common) {
            Double a = metricsA.get(metric);
            Double b = metricsB.get(metric);
            if (a == null || b == null) {
                continue;
            }
            double diff = b - a;
            double pct = a != 0.0d ? diff / a * 100.0 : 0.0;
            rows.put(metric, ComparisonResult.MetricComparison.builder()
                .valueA(a)
                .valueB(b)
                .difference(diff)
                .percentChange(pct)
                .improved(isLossMetric(metric) ? diff < 0 : diff > 0)
                .build());
        }
        return ComparisonResult.builder()
            .versionA(versionA)
            .versionB(versionB)
            .metrics(rows)
            .build();
    }

    public static boolean isLossMetric(String metric) {
        return "loss".equals(metric) || metric.endsWith("_loss");
    }
}
