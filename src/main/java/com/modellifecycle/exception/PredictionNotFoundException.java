package com.modellifecycle.exception;

import java.util.UUID;

public class PredictionNotFoundException extends NotFoundException {
    public PredictionNotFoundException(UUID predictionId) {
        super("PREDICTION_NOT_FOUND", "Prediction with id '" + predictionId + "' not found.");
    }
}
