package com.example.riskscan_backend.util;

/**
 * Per-modality job lifecycle. FAILED and TIMED_OUT go back to PENDING while retries remain.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean canTransitionTo(JobState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == SUCCEEDED || next == FAILED || next == TIMED_OUT;
            case FAILED -> next == PENDING;
            case TIMED_OUT -> next == PENDING || next == FAILED;
            case SUCCEEDED -> false;
        };
    }
}
