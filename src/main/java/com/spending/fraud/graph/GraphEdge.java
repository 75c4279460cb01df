package com.spending.fraud.graph;

import com.spending.fraud.core.model.RelationType;

import java.util.Objects;

/**
 * Undirected graph edge. Transaction edges join a vendor and an agency and carry an
 * aggregate; relationship edges join two vendors and carry a confidence.
 */
public record GraphEdge(
        NodeId source,
        NodeId target,
        EdgeType type,
        PaymentAggregate aggregate,
        RelationType relationType,
        double confidence
) {
    public enum EdgeType {
        TRANSACTION,
        RELATIONSHIP
    }

    public GraphEdge {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(type, "type is required");
    }

    static GraphEdge transaction(PaymentAggregate aggregate) {
        return new GraphEdge(aggregate.vendor(), aggregate.agency(), EdgeType.TRANSACTION, aggregate, null, 1.0);
    }

    static GraphEdge relationship(NodeId a, NodeId b, RelationType relationType, double confidence) {
        return a.compareTo(b) <= 0
                ? new GraphEdge(a, b, EdgeType.RELATIONSHIP, null, relationType, confidence)
                : new GraphEdge(b, a, EdgeType.RELATIONSHIP, null, relationType, confidence);
    }

    public boolean isTransaction() {
        return type == EdgeType.TRANSACTION;
    }

    public boolean isRelationship() {
        return type == EdgeType.RELATIONSHIP;
    }

    public NodeId other(NodeId node) {
        if (source.equals(node)) {
            return target;
        }
        if (target.equals(node)) {
            return source;
        }
        throw new IllegalArgumentException(node + " is not an end of " + this);
    }
}
