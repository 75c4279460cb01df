package com.spending.fraud.alert;

/**
 * Marker for the typed evidence carried by an alert request. Each alert type has its own
 * record; it is converted to a map once, when the alert is stored.
 */
public interface AlertEvidence {
}
