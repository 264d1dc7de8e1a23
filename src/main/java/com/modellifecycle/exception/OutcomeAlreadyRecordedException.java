package com.modellifecycle.exception;

import java.util.UUID;

public class OutcomeAlreadyRecordedException extends ModelLifecycleException {
    public OutcomeAlreadyRecordedException(UUID predictionId) {
        super("OUTCOME_ALREADY_RECORDED",
              "Prediction '" + predictionId + "' already has an actual outcome recorded.");
    }
}
