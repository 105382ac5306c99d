package com.demo.coordination.exception;

/**
 * A durable read or write failed. Fatal to the current run only.
 */
public class StoreFailureException extends RuntimeException {
    public StoreFailureException(String message) {
        super(message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
