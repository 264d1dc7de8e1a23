package com.modellifecycle.exception;

public class MlApiException extends ModelLifecycleException {
    public MlApiException(String message) {
        super("ML_API_ERROR", message);
    }
    public MlApiException(String message, Throwable cause) {
        super("ML_API_ERROR", message, cause);
    }
}
