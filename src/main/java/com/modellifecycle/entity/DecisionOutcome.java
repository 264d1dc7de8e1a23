package com.modellifecycle.entity;

/**
 * {@code RETRAIN_RECOMMENDED} is only produced by a trigger check; runs end in one of the others.
 */
public enum DecisionOutcome {
    SKIPPED,
    RETRAIN_RECOMMENDED,
    PROMOTED,
    NOT_PROMOTED,
    FAILED
}
