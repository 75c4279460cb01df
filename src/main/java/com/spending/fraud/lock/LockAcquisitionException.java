package com.spending.fraud.lock;

import com.spending.fraud.exception.DetectionException;

/**
 * Runtime exception thrown when a keyed lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends DetectionException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
