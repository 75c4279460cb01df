package com.spending.fraud.graph;

import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BipartiteGraphTest {

    private static BipartiteGraph graphWithVendorDegrees(int... degrees) {
        List<PaymentAggregate> aggregates = new ArrayList<>();
        for (int v = 0; v < degrees.length; v++) {
            for (int a = 0; a < degrees[v]; a++) {
                aggregates.add(PaymentAggregate.payments(v + 1, 100 + a, 1_000.0, 1));
            }
        }
        return GraphBuilder.build(aggregates);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should sum aggregates for the same vendor and agency")
        void testSummed() {
            BipartiteGraph graph = GraphBuilder.build(List.of(
                    PaymentAggregate.payments(1, 10, 500.0, 2),
                    PaymentAggregate.payments(1, 10, 250.0, 1),
                    new PaymentAggregate(1, 10, 0.0, 0, 40_000.0, 1)));

            PaymentAggregate aggregate = graph.aggregate(NodeId.vendor(1), NodeId.agency(10)).orElseThrow();
            assertEquals(750.0, aggregate.paymentTotal());
            assertEquals(3, aggregate.paymentCount());
            assertEquals(40_000.0, aggregate.contractTotal());
            assertEquals(1, graph.edgeCount());
        }

        @Test
        @DisplayName("Should copy only vendor-vendor relationships, keeping the strongest per pair")
        void testRelationships() {
            BipartiteGraph graph = GraphBuilder.build(
                    List.of(PaymentAggregate.payments(1, 10, 500.0, 1)),
                    List.of(
                            RelationshipEdge.of(EntityRef.vendor(1), EntityRef.vendor(2), RelationType.SAME_ADDRESS, 0.8),
                            RelationshipEdge.of(EntityRef.vendor(2), EntityRef.vendor(1), RelationType.SIMILAR_NAME, 0.93),
                            RelationshipEdge.of(EntityRef.employee(5), EntityRef.vendor(1), RelationType.NAME, 0.99)));

            GraphEdge edge = graph.relatedVendors(NodeId.vendor(1)).get(NodeId.vendor(2));
            assertEquals(0.93, edge.confidence());
            assertEquals(RelationType.SIMILAR_NAME, edge.relationType());
            assertEquals(3, graph.nodeCount());
            assertEquals(0, graph.degree(NodeId.vendor(2)));
        }

        @Test
        @DisplayName("Should summarize node and edge counts")
        void testStats() {
            GraphStats stats = graphWithVendorDegrees(2, 1).stats();

            assertEquals(2, stats.vendorCount());
            assertEquals(2, stats.agencyCount());
            assertEquals(3, stats.transactionEdges());
            assertEquals(1, stats.transactionComponents());
            assertEquals(1.5, stats.averageVendorDegree());
        }
    }

    @Nested
    @DisplayName("Degree outliers")
    class DegreeOutliers {

        @Test
        @DisplayName("Should flag only the vendor far above the mean and the minimum degree")
        void testSingleOutlier() {
            BipartiteGraph graph = graphWithVendorDegrees(2, 2, 3, 3, 4, 4, 20);

            List<DegreeOutlier> outliers = graph.degreeOutliers(NodeKind.VENDOR, 10, 2.0);

            assertEquals(1, outliers.size());
            assertEquals(NodeId.vendor(7), outliers.get(0).node());
            assertEquals(20, outliers.get(0).degree());
            assertTrue(outliers.get(0).zScore() >= 2.0);
        }

        @Test
        @DisplayName("Should flag nobody when every degree is equal")
        void testZeroDeviation() {
            BipartiteGraph graph = graphWithVendorDegrees(5, 5, 5, 5, 5, 5, 5);

            assertTrue(graph.degreeOutliers(NodeKind.VENDOR, 1, 2.0).isEmpty());
        }

        @Test
        @DisplayName("Should respect the minimum degree")
        void testMinimumDegree() {
            BipartiteGraph graph = graphWithVendorDegrees(2, 2, 3, 3, 4, 4, 20);

            assertTrue(graph.degreeOutliers(NodeKind.VENDOR, 21, 2.0).isEmpty());
        }
    }

    @Nested
    @DisplayName("Components and shares")
    class ComponentsAndShares {

        @Test
        @DisplayName("Should return relationship components largest first")
        void testComponents() {
            BipartiteGraph graph = GraphBuilder.build(
                    List.of(PaymentAggregate.payments(1, 10, 100.0, 1)),
                    List.of(
                            RelationshipEdge.of(EntityRef.vendor(4), EntityRef.vendor(5), RelationType.SAME_ADDRESS, 0.8),
                            RelationshipEdge.of(EntityRef.vendor(1), EntityRef.vendor(2), RelationType.SAME_ADDRESS, 0.8),
                            RelationshipEdge.of(EntityRef.vendor(2), EntityRef.vendor(3), RelationType.SIMILAR_NAME, 0.9)));

            List<Component> components = graph.connectedComponents(GraphEdge::isRelationship);

            assertEquals(2, components.size());
            assertEquals(List.of(NodeId.vendor(1), NodeId.vendor(2), NodeId.vendor(3)), components.get(0).members());
            assertEquals(List.of(NodeId.vendor(4), NodeId.vendor(5)), components.get(1).members());
            assertTrue(components.get(0).agencies().isEmpty());
        }

        @Test
        @DisplayName("Should find the dominant neighbour and its share")
        void testDominantShare() {
            BipartiteGraph graph = GraphBuilder.build(List.of(
                    PaymentAggregate.payments(1, 10, 900.0, 1),
                    PaymentAggregate.payments(2, 10, 100.0, 1)));

            EdgeShare share = graph.dominantEdgeShare(NodeId.agency(10), WeightMetric.PAYMENT_TOTAL).orElseThrow();

            assertEquals(NodeId.vendor(1), share.topNeighbor());
            assertEquals(0.9, share.share(), 1e-9);
            assertEquals(2, share.neighborCount());
        }

        @Test
        @DisplayName("Should report no share for nodes without positive weight")
        void testNoShare() {
            BipartiteGraph graph = GraphBuilder.build(List.of(new PaymentAggregate(1, 10, 0.0, 0, 5_000.0, 1)));

            assertTrue(graph.dominantEdgeShare(NodeId.agency(10), WeightMetric.PAYMENT_TOTAL).isEmpty());
            assertTrue(graph.dominantEdgeShare(NodeId.agency(99), WeightMetric.PAYMENT_TOTAL).isEmpty());
        }

        @Test
        @DisplayName("Should list counterparties shared with non-zero weight on both sides")
        void testSharedCounterparties() {
            BipartiteGraph graph = GraphBuilder.build(List.of(
                    PaymentAggregate.payments(1, 10, 100.0, 1),
                    PaymentAggregate.payments(1, 11, 200.0, 1),
                    PaymentAggregate.payments(2, 10, 300.0, 1),
                    new PaymentAggregate(2, 11, 0.0, 0, 1_000.0, 1),
                    PaymentAggregate.payments(2, 12, 50.0, 1)));

            List<SharedCounterparty> shared = graph.sharedCounterparties(NodeId.vendor(1), NodeId.vendor(2), WeightMetric.PAYMENT_TOTAL);

            assertEquals(1, shared.size());
            assertEquals(NodeId.agency(10), shared.get(0).counterparty());
            assertEquals(100.0, shared.get(0).weightA());
            assertEquals(300.0, shared.get(0).weightB());
        }
    }
}
