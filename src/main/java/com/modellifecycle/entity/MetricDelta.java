package com.modellifecycle.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MetricDelta {

    @Column(name = "baseline_value", nullable = false)
    private double baselineValue;

    @Column(name = "candidate_value", nullable = false)
    private double candidateValue;

    @Column(nullable = false)
    private double difference;

    @Column(name = "percent_change", nullable = false)
    private double percentChange;

    @Column(nullable = false)
    private boolean improved;
}
