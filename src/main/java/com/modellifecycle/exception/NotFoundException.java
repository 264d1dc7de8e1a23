package com.modellifecycle.exception;

public abstract class NotFoundException extends ModelLifecycleException {
    protected NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
