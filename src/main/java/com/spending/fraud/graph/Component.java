package com.spending.fraud.graph;

import java.util.List;

/**
 * A connected component; members are sorted.
 */
public record Component(List<NodeId> members) {

    public Component {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    public List<NodeId> vendors() {
        return members.stream().filter(NodeId::isVendor).toList();
    }

    public List<NodeId> agencies() {
        return members.stream().filter(n -> !n.isVendor()).toList();
    }
}
