package com.modellifecycle.exception;

public class DuplicateVersionException extends ModelLifecycleException {
    public DuplicateVersionException(String versionId) {
        super("DUPLICATE_VERSION", "Model version '" + versionId + "' is already registered.");
    }
}
