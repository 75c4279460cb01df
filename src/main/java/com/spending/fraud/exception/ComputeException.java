package com.spending.fraud.exception;

/**
 * Thrown when a matching batch or rule computation fails.
 */
public class ComputeException extends DetectionException {

    public ComputeException(String message) {
        super(message);
    }

    public ComputeException(String message, Throwable cause) {
        super(message, cause);
    }
}
