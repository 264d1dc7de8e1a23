package com.modellifecycle.exception;

import lombok.Getter;

@Getter
public abstract class ModelLifecycleException extends RuntimeException {
    private final String errorCode;
    protected ModelLifecycleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ModelLifecycleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
