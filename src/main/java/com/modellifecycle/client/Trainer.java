package com.modellifecycle.client;

import com.modellifecycle.entity.ModelType;

import java.util.Map;

/**
 * Produces a new model artifact from a dataset snapshot.
 */
public interface Trainer {

    /**
     * @throws com.modellifecycle.exception.TrainingFailedException when no artifact could be produced
     */
    TrainingResult train(String datasetReference);

    record TrainingResult(String artifactLocation, ModelType modelType, Map<String, Double> metrics) {}
}
