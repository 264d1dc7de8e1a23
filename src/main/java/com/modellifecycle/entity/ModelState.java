package com.modellifecycle.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link ModelVersion}.
 *
 * <p>Forward path is {@code REGISTERED -> STAGING -> PRODUCTION -> ARCHIVED}. The
 * demotions the registry performs as side effects of a promotion are also legal:
 * a displaced staging version returns to {@code REGISTERED}, a displaced production
 * version goes to {@code ARCHIVED}. {@code ARCHIVED -> PRODUCTION} and
 * {@code PRODUCTION -> REGISTERED} only happen inside a rollback.
 */
public enum ModelState {
    REGISTERED,
    STAGING,
    PRODUCTION,
    ARCHIVED;

    public boolean canTransitionTo(ModelState target, boolean rollback) {
        return allowedTargets(rollback).contains(target);
    }

    private Set<ModelState> allowedTargets(boolean rollback) {
        return switch (this) {
            case REGISTERED -> EnumSet.of(STAGING);
            case STAGING -> EnumSet.of(REGISTERED, PRODUCTION);
            case PRODUCTION -> rollback ? EnumSet.of(ARCHIVED, REGISTERED) : EnumSet.of(ARCHIVED);
            case ARCHIVED -> rollback ? EnumSet.of(PRODUCTION) : EnumSet.noneOf(ModelState.class);
        };
    }
}
