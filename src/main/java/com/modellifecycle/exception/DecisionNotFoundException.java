package com.modellifecycle.exception;

import java.util.UUID;

public class DecisionNotFoundException extends NotFoundException {
    public DecisionNotFoundException(UUID decisionId) {
        super("DECISION_NOT_FOUND", "Retraining decision with id '" + decisionId + "' not found.");
    }
}
