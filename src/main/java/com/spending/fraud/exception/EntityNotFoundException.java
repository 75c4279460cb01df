package com.spending.fraud.exception;

/**
 * Thrown when a referenced alert, rule or entity does not exist.
 */
public class EntityNotFoundException extends DetectionException {

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
