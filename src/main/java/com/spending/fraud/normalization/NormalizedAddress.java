package com.spending.fraud.normalization;

/**
 * Parsed and standardized address. Any component may be null; {@code normalized} joins the
 * present components with single spaces and is never null.
 */
public record NormalizedAddress(String street, String city, String state, String zip, String normalized) {

    public NormalizedAddress {
        normalized = normalized != null ? normalized : "";
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }
}
