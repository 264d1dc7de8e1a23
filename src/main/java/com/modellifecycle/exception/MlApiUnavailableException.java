package com.modellifecycle.exception;

public class MlApiUnavailableException extends ModelLifecycleException {
    public MlApiUnavailableException(Throwable cause) {
        super("ML_API_UNAVAILABLE",
              "The ML training service is currently unavailable. Please try again later.",
              cause);
    }
}
