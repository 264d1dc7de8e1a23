package com.modellifecycle.client;

import java.util.Map;

/**
 * Scores an artifact on a held-out set. Returned metric names use the same vocabulary
 * as registered model metrics ({@code accuracy}, {@code precision}, {@code recall},
 * {@code f1_score}, {@code auc_roc}, ...).
 */
public interface Evaluator {

    Map<String, Double> evaluate(String artifactLocation, String testSetReference);
}
