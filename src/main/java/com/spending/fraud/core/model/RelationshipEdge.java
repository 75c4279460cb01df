package com.spending.fraud.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A discovered relationship between two entities.
 *
 * <p>The pair is always held in canonical order: {@code first} compares lower than
 * {@code second}, whatever order the caller passed them in. A pair and relation type
 * therefore identify exactly one edge.</p>
 */
public record RelationshipEdge(
        EntityRef first,
        EntityRef second,
        RelationType relationType,
        double confidence,
        Map<String, Object> evidence
) {
    public RelationshipEdge {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        Objects.requireNonNull(relationType, "relationType is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("An entity cannot be related to itself: " + first);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (first.compareTo(second) > 0) {
            EntityRef swap = first;
            first = second;
            second = swap;
        }
        evidence = evidence != null ? Map.copyOf(evidence) : Map.of();
    }

    public static RelationshipEdge of(EntityRef a, EntityRef b, RelationType type, double confidence) {
        return new RelationshipEdge(a, b, type, confidence, Map.of());
    }

    public EntityKind entityKind1() {
        return first.kind();
    }

    public long entityId1() {
        return first.id();
    }

    public EntityKind entityKind2() {
        return second.kind();
    }

    public long entityId2() {
        return second.id();
    }

    /**
     * Returns true if the given entity is either end of this edge.
     */
    public boolean touches(EntityRef ref) {
        return first.equals(ref) || second.equals(ref);
    }

    /**
     * Returns the end opposite to the given entity.
     */
    public EntityRef other(EntityRef ref) {
        if (first.equals(ref)) {
            return second;
        }
        if (second.equals(ref)) {
            return first;
        }
        throw new IllegalArgumentException(ref + " is not part of " + this);
    }

    /**
     * Store key: one row per canonical pair and relation type.
     */
    public String key() {
        return first + "|" + second + "|" + relationType.getCode();
    }

    @Override
    public String toString() {
        return "RelationshipEdge{" + first + " -" + relationType.getCode() + "-> " + second
                + ", confidence=" + confidence + '}';
    }
}
