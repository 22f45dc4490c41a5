package com.example.riskscan_backend.engine.Interfaces;

/**
 * Snapshot of an asynchronous provider job.
 */
public record ProviderJob<T>(Status status, T result, String message) {
    public enum Status { IN_PROGRESS, SUCCEEDED, FAILED }

    public static <T> ProviderJob<T> inProgress() {
        return new ProviderJob<>(Status.IN_PROGRESS, null, null);
    }

    public static <T> ProviderJob<T> succeeded(T result) {
        return new ProviderJob<>(Status.SUCCEEDED, result, null);
    }

    public static <T> ProviderJob<T> failed(String message) {
        return new ProviderJob<>(Status.FAILED, null, message);
    }
}
