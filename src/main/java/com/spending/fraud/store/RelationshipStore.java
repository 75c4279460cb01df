package com.spending.fraud.store;

import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;

import java.util.List;

/**
 * Holds deduplicated relationship edges. One row exists per canonical pair and relation type,
 * and a row's confidence never decreases. Implementations must be safe for concurrent callers.
 */
public interface RelationshipStore {

    /**
     * Inserts the edge, or replaces the stored row when the new confidence is strictly greater.
     */
    UpsertResult upsert(RelationshipEdge edge);

    /**
     * All edges touching the entity, in either position.
     */
    List<RelationshipEdge> queryRelated(EntityKind kind, long id);

    /**
     * All edges of a relation type.
     */
    List<RelationshipEdge> queryPairs(RelationType relationType);

    /**
     * All edges joining an entity of {@code kind1} to an entity of {@code kind2}, in either position.
     */
    List<RelationshipEdge> queryBetween(EntityKind kind1, EntityKind kind2);

    List<RelationshipEdge> all();

    int size();
}
