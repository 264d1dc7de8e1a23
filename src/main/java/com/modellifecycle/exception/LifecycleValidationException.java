package com.modellifecycle.exception;

/**
 * Raised for illegal lifecycle transitions and malformed input.
 */
public class LifecycleValidationException extends ModelLifecycleException {
    public LifecycleValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
