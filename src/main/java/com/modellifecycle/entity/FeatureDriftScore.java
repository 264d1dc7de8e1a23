package com.modellifecycle.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class FeatureDriftScore {

    @Column(name = "ks_statistic", nullable = false)
    private double statistic;

    @Column(name = "p_value", nullable = false)
    private double pValue;

    @Column(name = "psi", nullable = false)
    private double populationStabilityIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "psi_level", nullable = false, length = 16)
    private PsiLevel psiLevel;

    @Column(name = "reference_count", nullable = false)
    private int referenceCount;

    @Column(name = "current_count", nullable = false)
    private int currentCount;

    @Column(nullable = false)
    private boolean drifted;
}
