package com.spending.fraud.matching;

import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.store.RelationshipStore;
import com.spending.fraud.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns candidate pairs into relationship edges and applies them to the store.
 * Called by the coordinator after all matching workers have returned, so upserts happen
 * on a single thread per call.
 */
public class RelationshipMatcher {
    private static final Logger log = LoggerFactory.getLogger(RelationshipMatcher.class);

    /**
     * Counts of upsert outcomes for one recording call.
     */
    public record RecordingSummary(int inserted, int updated, int unchanged) {

        public int total() {
            return inserted + updated + unchanged;
        }
    }

    private final RelationshipStore store;

    public RelationshipMatcher(RelationshipStore store) {
        this.store = store;
    }

    /**
     * Records each pair as an edge of the given type, using the pair score as confidence.
     */
    public RecordingSummary record(List<CandidatePair> pairs, RelationType relationType) {
        return record(pairs, relationType, RelationshipMatcher::defaultEvidence);
    }

    /**
     * Records each pair as an edge of the given type with caller-supplied evidence.
     */
    public RecordingSummary record(List<CandidatePair> pairs, RelationType relationType,
                                   Function<CandidatePair, Map<String, Object>> evidence) {
        Map<UpsertResult, Integer> counts = new EnumMap<>(UpsertResult.class);
        for (CandidatePair pair : pairs) {
            if (pair.first().equals(pair.second())) {
                continue;
            }
            RelationshipEdge edge = new RelationshipEdge(
                    pair.first(), pair.second(), relationType, pair.score(), evidence.apply(pair));
            counts.merge(store.upsert(edge), 1, Integer::sum);
        }
        RecordingSummary summary = new RecordingSummary(
                counts.getOrDefault(UpsertResult.INSERTED, 0),
                counts.getOrDefault(UpsertResult.UPDATED, 0),
                counts.getOrDefault(UpsertResult.UNCHANGED, 0));
        log.debug("relationships.recorded type={} inserted={} updated={} unchanged={}",
                relationType.getCode(), summary.inserted(), summary.updated(), summary.unchanged());
        return summary;
    }

    static Map<String, Object> defaultEvidence(CandidatePair pair) {
        return Map.of(
                "similarity", pair.score(),
                "method", pair.isExact() ? "exact" : "fuzzy");
    }
}
