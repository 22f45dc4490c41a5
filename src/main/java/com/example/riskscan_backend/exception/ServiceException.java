package com.example.riskscan_backend.exception;

/**
 * Failure reported by an external capability provider.
 */
public abstract class ServiceException extends RuntimeException {
    private final String provider;

    protected ServiceException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
