package com.spending.fraud.graph;

import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.EntityRef;

import java.util.Comparator;
import java.util.Objects;

/**
 * Tagged graph node identifier. Ordered by kind (vendors first), then id.
 */
public record NodeId(NodeKind kind, long id) implements Comparable<NodeId> {

    private static final Comparator<NodeId> ORDER = Comparator
            .comparing(NodeId::kind)
            .thenComparingLong(NodeId::id);

    public NodeId {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static NodeId vendor(long id) {
        return new NodeId(NodeKind.VENDOR, id);
    }

    public static NodeId agency(long id) {
        return new NodeId(NodeKind.AGENCY, id);
    }

    public boolean isVendor() {
        return kind == NodeKind.VENDOR;
    }

    public EntityRef toEntityRef() {
        return new EntityRef(kind == NodeKind.VENDOR ? EntityKind.VENDOR : EntityKind.AGENCY, id);
    }

    @Override
    public int compareTo(NodeId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.getLabel() + ":" + id;
    }
}
