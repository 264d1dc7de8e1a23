package com.modellifecycle.exception;

public class ModelVersionNotFoundException extends NotFoundException {
    public ModelVersionNotFoundException(String versionId) {
        super("MODEL_VERSION_NOT_FOUND", "Model version '" + versionId + "' not found.");
    }
}
