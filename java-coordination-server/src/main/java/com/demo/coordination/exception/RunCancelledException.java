package com.demo.coordination.exception;

/**
 * Raised inside a run when it was cancelled, timed out, or lost its lock.
 */
public class RunCancelledException extends RuntimeException {
    public RunCancelledException(String message) {
        super(message);
    }
}
