package com.modellifecycle.entity;

/**
 * Phases of one orchestrator run:
 * {@code IDLE -> CHECKING_TRIGGERS -> (SKIPPED | PREPARING -> TRAINING -> EVALUATING -> COMPARING -> (PROMOTING | RECORDED))}.
 */
public enum RetrainingPhase {
    IDLE,
    CHECKING_TRIGGERS,
    SKIPPED,
    PREPARING,
    TRAINING,
    EVALUATING,
    COMPARING,
    PROMOTING,
    RECORDED
}
