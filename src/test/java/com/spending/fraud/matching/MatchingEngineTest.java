package com.spending.fraud.matching;

import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.metrics.MicrometerMetricsService;
import com.spending.fraud.metrics.NoOpMetricsService;
import com.spending.fraud.normalization.DefaultBlockingKeyStrategy;
import com.spending.fraud.similarity.IndelSimilarity;
import com.spending.fraud.similarity.SimilarityAlgorithm;
import com.spending.fraud.store.InMemoryRelationshipStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineTest {

    private MatchingEngine engine;
    private MatchingOptions options;
    private List<CanonicalEntity> vendors;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine();
        options = MatchingOptions.builder().threshold(0.8).build();
        vendors = List.of(
                vendor(1, "ACME SUPPLY"),
                vendor(2, "ACME SUPPLIES"),
                vendor(3, "ACME SUPPLY"),
                vendor(4, "ZEBRA LOGISTICS"),
                vendor(5, null));
    }

    private static CanonicalEntity vendor(long id, String name) {
        return CanonicalEntity.builder().id(id).kind(EntityKind.VENDOR).normalizedName(name).build();
    }

    private static CanonicalEntity employee(long id, String name) {
        return CanonicalEntity.builder().id(id).kind(EntityKind.EMPLOYEE).normalizedName(name).build();
    }

    @Nested
    @DisplayName("Self-matching")
    class SelfMatching {

        @Test
        @DisplayName("Should emit each unordered pair once, lower entity first, sorted")
        void testPairs() {
            MatchingResult result = engine.match(vendors, options);

            assertEquals(List.of(
                    new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(2), 20.0 / 24.0),
                    new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(3), 1.0),
                    new CandidatePair(EntityRef.vendor(2), EntityRef.vendor(3), 20.0 / 24.0)
            ), result.pairs());
            assertTrue(result.pairs().get(1).isExact());
            assertTrue(result.isComplete());
        }

        @Test
        @DisplayName("Should skip entities without a normalized name")
        void testSkipped() {
            assertEquals(1, engine.match(vendors, options).skippedEntities());
        }

        @Test
        @DisplayName("Should keep only the best candidates per item")
        void testCandidateCap() {
            MatchingOptions capped = options.toBuilder().maxCandidatesPerItem(1).build();

            MatchingResult result = engine.match(vendors, capped);

            assertEquals(List.of(
                    new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(2), 20.0 / 24.0),
                    new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(3), 1.0)
            ), result.pairs());
        }

        @Test
        @DisplayName("Should return no pairs below the threshold")
        void testThreshold() {
            MatchingResult result = engine.match(vendors, options.withThreshold(0.9));

            assertEquals(1, result.pairs().size());
            assertEquals(1.0, result.pairs().get(0).score());
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Should produce the same pairs for any batch size and worker count")
        void testBatchingIndependent() {
            MatchingResult sequential = engine.match(vendors, options.toBuilder().batchSize(1000).maxWorkers(1).build());
            MatchingResult parallel = engine.match(vendors, options.toBuilder().batchSize(1).maxWorkers(4).build());

            assertEquals(sequential.pairs(), parallel.pairs());
        }

        @Test
        @DisplayName("Should leave the store unchanged when the same match is recorded twice")
        void testIdempotentRecording() {
            InMemoryRelationshipStore store = new InMemoryRelationshipStore();
            RelationshipMatcher matcher = new RelationshipMatcher(store);

            RelationshipMatcher.RecordingSummary first =
                    matcher.record(engine.match(vendors, options).pairs(), RelationType.SIMILAR_NAME);
            List<RelationshipEdge> snapshot = store.all();
            RelationshipMatcher.RecordingSummary second =
                    matcher.record(engine.match(vendors, options).pairs(), RelationType.SIMILAR_NAME);

            assertEquals(3, first.inserted());
            assertEquals(0, second.inserted());
            assertEquals(0, second.updated());
            assertEquals(3, second.unchanged());
            assertEquals(snapshot, store.all());
        }

        @Test
        @DisplayName("Should record default evidence with the method used")
        void testDefaultEvidence() {
            InMemoryRelationshipStore store = new InMemoryRelationshipStore();
            new RelationshipMatcher(store).record(engine.match(vendors, options).pairs(), RelationType.SIMILAR_NAME);

            assertEquals("exact", store.queryRelated(EntityKind.VENDOR, 3).stream()
                    .filter(edge -> edge.entityId1() == 1)
                    .findFirst().orElseThrow().evidence().get("method"));
        }
    }

    @Nested
    @DisplayName("Cross-matching")
    class CrossMatching {

        @Test
        @DisplayName("Should put the probed collection's entity first")
        void testOrientation() {
            List<CanonicalEntity> employees = List.of(employee(10, "ACME SUPPLY"));

            MatchingResult result = engine.match(employees, vendors, options);

            assertFalse(result.pairs().isEmpty());
            result.pairs().forEach(pair -> {
                assertEquals(EntityRef.employee(10), pair.first());
                assertEquals(EntityKind.VENDOR, pair.second().kind());
            });
        }

        @Test
        @DisplayName("Should return an empty result when one side is empty")
        void testEmptySide() {
            assertTrue(engine.match(List.of(), vendors, options).pairs().isEmpty());
        }
    }

    @Nested
    @DisplayName("Failures and metrics")
    class FailuresAndMetrics {

        @Test
        @DisplayName("Should report a failed batch and keep the others' pairs")
        void testFailedBatch() {
            SimilarityAlgorithm failing = new SimilarityAlgorithm() {
                private final IndelSimilarity delegate = new IndelSimilarity();

                @Override
                public double compute(String s1, String s2) {
                    if (s1.startsWith("BOOM")) {
                        throw new IllegalStateException("scorer failed");
                    }
                    return delegate.compute(s1, s2);
                }

                @Override
                public String getName() {
                    return "failing";
                }
            };
            MatchingEngine failingEngine = new MatchingEngine(failing, new DefaultBlockingKeyStrategy(), new NoOpMetricsService());
            List<CanonicalEntity> entities = List.of(
                    vendor(1, "ACME SUPPLY"), vendor(2, "ACME SUPPLIES"), vendor(3, "BOOM ACME SUPPLY"));

            MatchingResult result = failingEngine.match(entities, options.toBuilder().batchSize(1).build());

            assertEquals(1, result.failedBatches());
            assertFalse(result.isComplete());
            assertEquals(1, result.batchErrors().size());
            assertTrue(result.pairs().contains(new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(2), 20.0 / 24.0)));
        }

        @Test
        @DisplayName("Should count pairs and skipped entities")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MatchingEngine metered = new MatchingEngine(new IndelSimilarity(), new DefaultBlockingKeyStrategy(),
                    new MicrometerMetricsService(registry));

            metered.match(vendors, options);

            assertEquals(3.0, registry.get("fraud.matching.pairs").counter().count());
            assertEquals(1.0, registry.get("fraud.matching.skipped").counter().count());
            assertEquals(1, registry.get("fraud.matching.batch.duration").tag("outcome", "ok").timer().count());
        }

        @Test
        @DisplayName("Should drop oversized buckets and count them, keeping exact-name pairs")
        void testOversizedBlocks() {
            MatchingResult result = engine.match(vendors, options.toBuilder().maxBlockSize(1).build());

            // ACME SUPPLY and ACME SUPPLIES only share buckets that also hold vendor 3
            assertTrue(result.oversizedBlocks() > 0);
            assertEquals(List.of(new CandidatePair(EntityRef.vendor(1), EntityRef.vendor(3), 1.0)), result.pairs());
        }
    }
}
