package com.demo.coordination.exception;

/**
 * The completion source failed before or during generation.
 */
public class ProviderFailureException extends RuntimeException {
    public ProviderFailureException(String message) {
        super(message);
    }

    public ProviderFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
