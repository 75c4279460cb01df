package com.spending.fraud.alert;

/**
 * Result of {@link AlertEngine#createAlert}: the new alert's id, or the open alert it duplicates.
 */
public record AlertCreationResult(boolean created, long alertId) {

    public static AlertCreationResult created(long alertId) {
        return new AlertCreationResult(true, alertId);
    }

    public static AlertCreationResult duplicate(long existingAlertId) {
        return new AlertCreationResult(false, existingAlertId);
    }

    public boolean isDuplicate() {
        return !created;
    }
}
