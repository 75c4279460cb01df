package com.spending.fraud.graph;

/**
 * Summary figures of a built graph.
 */
public record GraphStats(
        int vendorCount,
        int agencyCount,
        int transactionEdges,
        int relationshipEdges,
        int transactionComponents,
        double averageVendorDegree,
        double averageAgencyDegree
) {
    public int nodeCount() {
        return vendorCount + agencyCount;
    }

    public int edgeCount() {
        return transactionEdges + relationshipEdges;
    }
}
