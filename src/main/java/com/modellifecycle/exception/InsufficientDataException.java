package com.modellifecycle.exception;

public class InsufficientDataException extends ModelLifecycleException {
    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
