package com.modellifecycle.entity;

/**
 * Conventional Population Stability Index bands.
 */
public enum PsiLevel {
    STABLE,
    MODERATE,
    SIGNIFICANT;

    public static PsiLevel of(double psi) {
        if (psi < 0.1) {
            return STABLE;
        }
        return psi <= 0.25 ? MODERATE : SIGNIFICANT;
    }
}
