package com.modellifecycle.dto;

public enum AsyncJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
