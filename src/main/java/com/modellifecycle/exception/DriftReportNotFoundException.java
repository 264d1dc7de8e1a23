package com.modellifecycle.exception;

import java.util.UUID;

public class DriftReportNotFoundException extends NotFoundException {
    public DriftReportNotFoundException(UUID reportId) {
        super("DRIFT_REPORT_NOT_FOUND", "Drift report with id '" + reportId + "' not found.");
    }
}
