package com.modellifecycle.exception;

import com.modellifecycle.entity.ModelState;

public class ProtectedVersionException extends ModelLifecycleException {
    public ProtectedVersionException(String versionId, ModelState state) {
        super("PROTECTED_VERSION",
              "Model version '" + versionId + "' is in state " + state + " and cannot be deleted.");
    }
}
