package com.modellifecycle.entity;

public enum TriggerReason {
    MANUAL,
    PERFORMANCE_DEGRADATION,
    DRIFT,
    SCHEDULED
}
