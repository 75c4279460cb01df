package com.spending.fraud.graph;

/**
 * Share of a node's total edge weight going to its single largest neighbour.
 */
public record EdgeShare(NodeId node, NodeId topNeighbor, double topWeight, double totalWeight, int neighborCount) {

    public double share() {
        return totalWeight == 0.0 ? 0.0 : topWeight / totalWeight;
    }
}
