package com.spending.fraud.core.model;

/**
 * Types of relationship edges discovered between entities.
 */
public enum RelationType {
    SAME_ADDRESS("same_address"),
    SIMILAR_NAME("similar_name"),
    SEQUENTIAL_ID("sequential_id"),
    NAME("name"),
    ADDRESS("address"),
    EXCLUSION_NAME("exclusion_name"),
    EXCLUSION_ADDRESS("exclusion_address");

    private final String code;

    RelationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
