package com.spending.fraud.graph;

/**
 * A neighbour common to two nodes, with the weight on each side.
 */
public record SharedCounterparty(NodeId counterparty, double weightA, double weightB) {
}
