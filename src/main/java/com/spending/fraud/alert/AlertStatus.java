package com.spending.fraud.alert;

/**
 * Alert workflow status. Statuses other than {@link #RESOLVED} and {@link #FALSE_POSITIVE}
 * are open: while an open alert exists, another alert for the same type and entity is a duplicate.
 */
public enum AlertStatus {
    NEW,
    ACKNOWLEDGED,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isOpen() {
        return this == NEW || this == ACKNOWLEDGED || this == INVESTIGATING;
    }
}
