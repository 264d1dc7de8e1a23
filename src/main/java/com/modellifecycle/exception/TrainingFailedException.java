package com.modellifecycle.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TrainingFailedException extends ModelLifecycleException {

    /** Audit record written for the failed run, when one exists. */
    private final UUID decisionId;

    public TrainingFailedException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public TrainingFailedException(String message, Throwable cause, UUID decisionId) {
        super("TRAINING_FAILED", message, cause);
        this.decisionId = decisionId;
    }

    public TrainingFailedException withDecision(UUID decisionId) {
        return new TrainingFailedException(getMessage(), getCause(), decisionId);
    }
}
