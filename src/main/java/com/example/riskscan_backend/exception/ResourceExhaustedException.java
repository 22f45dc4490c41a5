package com.example.riskscan_backend.exception;

import com.example.riskscan_backend.util.FailureReason;

public class ResourceExhaustedException extends AnalysisException {
    public ResourceExhaustedException(String message) {
        super(FailureReason.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(FailureReason.RESOURCE_EXHAUSTED, message, cause);
    }
}
