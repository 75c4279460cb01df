package com.spending.fraud.exception;

/**
 * Base runtime exception for the fraud detection engine.
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
