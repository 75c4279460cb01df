package com.spending.fraud.core.model;

/**
 * Kinds of entities that take part in relationship matching or are the subject of an alert.
 * Declaration order is the canonical kind order used for cross-type edges.
 */
public enum EntityKind {
    VENDOR("vendor"),
    EMPLOYEE("employee"),
    CONTRIBUTOR("contributor"),
    AGENCY("agency"),
    DEBARRED("debarred"),
    TAX_PERMIT("tax_permit"),
    CONTRACT("contract");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true for kinds whose names are personal names rather than business names.
     */
    public boolean isPerson() {
        return this == EMPLOYEE || this == CONTRIBUTOR;
    }
}
