package com.modellifecycle.exception;

public class NoRollbackTargetException extends ModelLifecycleException {
    public NoRollbackTargetException() {
        super("NO_ROLLBACK_TARGET", "No archived model version is available for rollback.");
    }
}
