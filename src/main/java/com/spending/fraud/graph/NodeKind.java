package com.spending.fraud.graph;

/**
 * The two sides of the payment graph.
 */
public enum NodeKind {
    VENDOR("vendor"),
    AGENCY("agency");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
