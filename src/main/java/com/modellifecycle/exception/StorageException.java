package com.modellifecycle.exception;

public class StorageException extends ModelLifecycleException {
    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
    public StorageException(String message) {
        super("STORAGE_ERROR", message);
    }
}
