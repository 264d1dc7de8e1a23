package com.modellifecycle.service;

import com.modellifecycle.dto.ComparisonResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricComparatorTest {

    @Test
    void compare_onlyCommonMetrics() {
        ComparisonResult result = MetricComparator.compare(
            "v1", Map.of("accuracy", 0.80, "precision", 0.70),
            "v2", Map.of("accuracy", 0.88, "recall", 0.60));

        assertThat(result.getMetrics()).containsOnlyKeys("accuracy");
        ComparisonResult.MetricComparison acc = result.getMetrics().get("accuracy");
        assertThat(acc.getDifference()).isCloseTo(0.08, within(1e-9));
        assertThat(acc.getPercentChange()).isCloseTo(10.0, within(1e-9));
        assertThat(acc.isImproved()).isTrue();
    }

    @Test
    void lossMetrics_lowerIsBetter() {
        ComparisonResult result = MetricComparator.compare(
            "v1", Map.of("loss", 0.40, "log_loss", 0.30, "accuracy", 0.9),
            "v2", Map.of("loss", 0.35, "log_loss", 0.45, "accuracy", 0.9));

        assertThat(result.improved("loss")).isTrue();
        assertThat(result.improved("log_loss")).isFalse();
    }

    @Test
    void tie_isNotAnImprovement() {
        ComparisonResult result = MetricComparator.compare(
            "v1", Map.of("accuracy", 0.9), "v2", Map.of("accuracy", 0.9));
        assertThat(result.improved("accuracy")).isFalse();
    }

    @Test
    void zeroBaseline_reportsZeroPercentChange() {
        ComparisonResult result = MetricComparator.compare(
            "v1", Map.of("auc_roc", 0.0), "v2", Map.of("auc_roc", 0.5));
        assertThat(result.getMetrics().get("auc_roc").getPercentChange()).isZero();
        assertThat(result.improved("auc_roc")).isTrue();
    }
}
