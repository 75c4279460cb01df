package com.spending.fraud.graph;

import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationshipEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Materializes a {@link BipartiteGraph} from vendor/agency aggregates and relationship edges.
 */
public final class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private GraphBuilder() {
    }

    public static BipartiteGraph build(List<PaymentAggregate> aggregates) {
        return build(aggregates, List.of());
    }

    /**
     * Builds the graph. Aggregates for the same vendor and agency are summed. Of the
     * relationship edges, only vendor-vendor ones are copied, keeping the highest
     * confidence per pair.
     */
    public static BipartiteGraph build(List<PaymentAggregate> aggregates, List<RelationshipEdge> relationshipEdges) {
        Map<String, PaymentAggregate> summed = new TreeMap<>();
        for (PaymentAggregate aggregate : aggregates) {
            summed.merge(aggregate.vendorId() + ":" + aggregate.agencyId(), aggregate, PaymentAggregate::plus);
        }

        NavigableSet<NodeId> nodes = new TreeSet<>();
        Map<NodeId, NavigableMap<NodeId, GraphEdge>> transactions = new HashMap<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (PaymentAggregate aggregate : summed.values()) {
            GraphEdge edge = GraphEdge.transaction(aggregate);
            nodes.add(edge.source());
            nodes.add(edge.target());
            transactions.computeIfAbsent(edge.source(), k -> new TreeMap<>()).put(edge.target(), edge);
            transactions.computeIfAbsent(edge.target(), k -> new TreeMap<>()).put(edge.source(), edge);
            edges.add(edge);
        }

        Map<String, GraphEdge> strongest = new TreeMap<>();
        for (RelationshipEdge rel : relationshipEdges) {
            if (rel.entityKind1() != EntityKind.VENDOR || rel.entityKind2() != EntityKind.VENDOR) {
                continue;
            }
            GraphEdge edge = GraphEdge.relationship(
                    NodeId.vendor(rel.entityId1()), NodeId.vendor(rel.entityId2()),
                    rel.relationType(), rel.confidence());
            strongest.merge(edge.source() + "|" + edge.target(), edge,
                    (a, b) -> b.confidence() > a.confidence() ? b : a);
        }

        Map<NodeId, NavigableMap<NodeId, GraphEdge>> relationships = new HashMap<>();
        for (GraphEdge edge : strongest.values()) {
            nodes.add(edge.source());
            nodes.add(edge.target());
            relationships.computeIfAbsent(edge.source(), k -> new TreeMap<>()).put(edge.target(), edge);
            relationships.computeIfAbsent(edge.target(), k -> new TreeMap<>()).put(edge.source(), edge);
            edges.add(edge);
        }

        log.info("graph.built nodes={} transactionEdges={} relationshipEdges={}",
                nodes.size(), summed.size(), strongest.size());
        return new BipartiteGraph(nodes, transactions, relationships, edges);
    }
}
