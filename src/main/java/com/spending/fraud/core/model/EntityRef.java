package com.spending.fraud.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Reference to an entity by kind and id.
 * Natural ordering is the canonical ordering: kind declaration order first, then id.
 */
public record EntityRef(EntityKind kind, long id) implements Comparable<EntityRef> {

    private static final Comparator<EntityRef> CANONICAL = Comparator
            .comparing(EntityRef::kind)
            .thenComparingLong(EntityRef::id);

    public EntityRef {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static EntityRef of(EntityKind kind, long id) {
        return new EntityRef(kind, id);
    }

    public static EntityRef vendor(long id) {
        return new EntityRef(EntityKind.VENDOR, id);
    }

    public static EntityRef employee(long id) {
        return new EntityRef(EntityKind.EMPLOYEE, id);
    }

    public static EntityRef agency(long id) {
        return new EntityRef(EntityKind.AGENCY, id);
    }

    @Override
    public int compareTo(EntityRef other) {
        return CANONICAL.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.getLabel() + ":" + id;
    }
}
