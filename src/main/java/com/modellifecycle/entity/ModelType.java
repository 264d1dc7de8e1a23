package com.modellifecycle.entity;

public enum ModelType {
    TREE_ENSEMBLE,
    GRADIENT_BOOSTED,
    NEURAL_NET,
    ENSEMBLE
}
