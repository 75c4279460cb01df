package com.spending.fraud.store;

import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.lock.KeyedLock;
import com.spending.fraud.lock.StripedKeyedLock;
import com.spending.fraud.metrics.MetricsService;
import com.spending.fraud.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory relationship store. Upserts are serialized per edge key with a {@link KeyedLock};
 * reads are lock-free and return snapshots sorted in canonical order.
 */
public class InMemoryRelationshipStore implements RelationshipStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRelationshipStore.class);

    static final Comparator<RelationshipEdge> EDGE_ORDER = Comparator
            .comparing(RelationshipEdge::first)
            .thenComparing(RelationshipEdge::second)
            .thenComparing(RelationshipEdge::relationType);

    private final Map<String, RelationshipEdge> edges = new ConcurrentHashMap<>();
    private final KeyedLock lock;
    private final MetricsService metrics;

    public InMemoryRelationshipStore() {
        this(new StripedKeyedLock(), new NoOpMetricsService());
    }

    public InMemoryRelationshipStore(KeyedLock lock, MetricsService metrics) {
        this.lock = lock;
        this.metrics = metrics;
    }

    @Override
    public UpsertResult upsert(RelationshipEdge edge) {
        String key = edge.key();
        UpsertResult result = lock.withLock(key, () -> {
            RelationshipEdge existing = edges.get(key);
            if (existing == null) {
                edges.put(key, edge);
                return UpsertResult.INSERTED;
            }
            if (edge.confidence() > existing.confidence()) {
                edges.put(key, edge);
                return UpsertResult.UPDATED;
            }
            return UpsertResult.UNCHANGED;
        });
        log.trace("relationship.upsert key={} confidence={} result={}", key, edge.confidence(), result);
        metrics.incrementRelationshipUpsert(result);
        return result;
    }

    @Override
    public List<RelationshipEdge> queryRelated(EntityKind kind, long id) {
        EntityRef ref = new EntityRef(kind, id);
        return select(edge -> edge.touches(ref));
    }

    @Override
    public List<RelationshipEdge> queryPairs(RelationType relationType) {
        return select(edge -> edge.relationType() == relationType);
    }

    @Override
    public List<RelationshipEdge> queryBetween(EntityKind kind1, EntityKind kind2) {
        return select(edge -> (edge.entityKind1() == kind1 && edge.entityKind2() == kind2)
                || (edge.entityKind1() == kind2 && edge.entityKind2() == kind1));
    }

    @Override
    public List<RelationshipEdge> all() {
        return select(edge -> true);
    }

    @Override
    public int size() {
        return edges.size();
    }

    private List<RelationshipEdge> select(Predicate<RelationshipEdge> filter) {
        return edges.values().stream()
                .filter(filter)
                .sorted(EDGE_ORDER)
                .toList();
    }
}
