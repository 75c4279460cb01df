package com.spending.fraud.exception;

/**
 * Thrown when input records or configuration values are structurally invalid.
 */
public class ValidationException extends DetectionException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
