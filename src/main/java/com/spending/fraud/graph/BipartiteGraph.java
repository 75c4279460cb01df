package com.spending.fraud.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable vendor/agency graph for one detection run. Transaction edges join vendors to
 * agencies; relationship edges join vendors to vendors. All queries are read-only, so one
 * instance can be shared by concurrently running rules.
 *
 * <p>Instances are created by {@link GraphBuilder}.</p>
 */
public final class BipartiteGraph {

    private static final Comparator<Component> LARGEST_FIRST = Comparator
            .comparingInt(Component::size).reversed()
            .thenComparing(c -> c.members().get(0));

    private final NavigableSet<NodeId> nodes;
    private final Map<NodeId, NavigableMap<NodeId, GraphEdge>> transactions;
    private final Map<NodeId, NavigableMap<NodeId, GraphEdge>> relationships;
    private final List<GraphEdge> edges;

    BipartiteGraph(NavigableSet<NodeId> nodes,
                   Map<NodeId, NavigableMap<NodeId, GraphEdge>> transactions,
                   Map<NodeId, NavigableMap<NodeId, GraphEdge>> relationships,
                   List<GraphEdge> edges) {
        this.nodes = Collections.unmodifiableNavigableSet(nodes);
        this.transactions = Collections.unmodifiableMap(transactions);
        this.relationships = Collections.unmodifiableMap(relationships);
        this.edges = List.copyOf(edges);
    }

    public Set<NodeId> nodes() {
        return nodes;
    }

    public List<NodeId> nodes(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }

    public boolean contains(NodeId node) {
        return nodes.contains(node);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Transaction neighbours of the node with their aggregates, sorted by neighbour.
     */
    public NavigableMap<NodeId, PaymentAggregate> transactionNeighbors(NodeId node) {
        NavigableMap<NodeId, PaymentAggregate> result = new TreeMap<>();
        transactions.getOrDefault(node, Collections.emptyNavigableMap())
                .forEach((neighbor, edge) -> result.put(neighbor, edge.aggregate()));
        return Collections.unmodifiableNavigableMap(result);
    }

    /**
     * Vendors joined to the given vendor by relationship edges.
     */
    public NavigableMap<NodeId, GraphEdge> relatedVendors(NodeId vendor) {
        return Collections.unmodifiableNavigableMap(
                relationships.getOrDefault(vendor, Collections.emptyNavigableMap()));
    }

    public Optional<PaymentAggregate> aggregate(NodeId vendor, NodeId agency) {
        GraphEdge edge = transactions.getOrDefault(vendor, Collections.emptyNavigableMap()).get(agency);
        return edge == null ? Optional.empty() : Optional.of(edge.aggregate());
    }

    /**
     * Number of transaction neighbours.
     */
    public int degree(NodeId node) {
        return transactions.getOrDefault(node, Collections.emptyNavigableMap()).size();
    }

    /**
     * Total edge weight of the node's transaction edges.
     */
    public double weight(NodeId node, WeightMetric metric) {
        double total = 0.0;
        for (GraphEdge edge : transactions.getOrDefault(node, Collections.emptyNavigableMap()).values()) {
            total += metric.weight(edge.aggregate());
        }
        return total;
    }

    /**
     * Connected components of the subgraph made of the edges accepted by {@code filter}.
     * Only nodes incident to at least one accepted edge appear. Components are returned
     * largest first, ties by lowest member.
     */
    public List<Component> connectedComponents(Predicate<GraphEdge> filter) {
        Map<NodeId, Set<NodeId>> adjacency = new TreeMap<>();
        for (GraphEdge edge : edges) {
            if (filter.test(edge)) {
                adjacency.computeIfAbsent(edge.source(), k -> new TreeSet<>()).add(edge.target());
                adjacency.computeIfAbsent(edge.target(), k -> new TreeSet<>()).add(edge.source());
            }
        }

        Set<NodeId> visited = new HashSet<>();
        List<Component> components = new ArrayList<>();
        for (NodeId start : adjacency.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            NavigableSet<NodeId> members = new TreeSet<>();
            Deque<NodeId> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                NodeId current = queue.poll();
                members.add(current);
                for (NodeId next : adjacency.get(current)) {
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
            components.add(new Component(new ArrayList<>(members)));
        }
        components.sort(LARGEST_FIRST);
        return components;
    }

    /**
     * Nodes of the kind whose transaction degree is at least {@code mean + z * stddev} and at
     * least {@code minDegree}. Mean and population standard deviation are taken over nodes of
     * the kind having at least one transaction edge. A zero standard deviation flags nobody.
     * Sorted by degree descending, then node.
     */
    public List<DegreeOutlier> degreeOutliers(NodeKind kind, int minDegree, double zThreshold) {
        List<NodeId> candidates = new ArrayList<>();
        for (NodeId node : nodes) {
            if (node.kind() == kind && degree(node) > 0) {
                candidates.add(node);
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        double sum = 0.0;
        for (NodeId node : candidates) {
            sum += degree(node);
        }
        double mean = sum / candidates.size();
        double squares = 0.0;
        for (NodeId node : candidates) {
            double diff = degree(node) - mean;
            squares += diff * diff;
        }
        double stddev = Math.sqrt(squares / candidates.size());
        if (stddev == 0.0) {
            return List.of();
        }

        double cutoff = mean + zThreshold * stddev;
        List<DegreeOutlier> outliers = new ArrayList<>();
        for (NodeId node : candidates) {
            int degree = degree(node);
            if (degree >= cutoff && degree >= minDegree) {
                outliers.add(new DegreeOutlier(node, degree, mean, stddev));
            }
        }
        outliers.sort(Comparator.comparingInt(DegreeOutlier::degree).reversed()
                .thenComparing(DegreeOutlier::node));
        return outliers;
    }

    /**
     * The node's largest neighbour by weight and its share of the node's total weight.
     * Ties go to the lower neighbour. Empty when the node has no positive weight.
     */
    public Optional<EdgeShare> dominantEdgeShare(NodeId node, WeightMetric metric) {
        NavigableMap<NodeId, GraphEdge> neighbors = transactions.get(node);
        if (neighbors == null || neighbors.isEmpty()) {
            return Optional.empty();
        }
        double total = 0.0;
        NodeId top = null;
        double topWeight = 0.0;
        for (Map.Entry<NodeId, GraphEdge> entry : neighbors.entrySet()) {
            double weight = metric.weight(entry.getValue().aggregate());
            total += weight;
            if (top == null || weight > topWeight) {
                top = entry.getKey();
                topWeight = weight;
            }
        }
        if (total <= 0.0) {
            return Optional.empty();
        }
        return Optional.of(new EdgeShare(node, top, topWeight, total, neighbors.size()));
    }

    /**
     * Transaction neighbours common to both nodes with non-zero weight on each side, sorted.
     */
    public List<SharedCounterparty> sharedCounterparties(NodeId a, NodeId b, WeightMetric metric) {
        NavigableMap<NodeId, GraphEdge> left = transactions.getOrDefault(a, Collections.emptyNavigableMap());
        NavigableMap<NodeId, GraphEdge> right = transactions.getOrDefault(b, Collections.emptyNavigableMap());
        List<SharedCounterparty> shared = new ArrayList<>();
        for (Map.Entry<NodeId, GraphEdge> entry : left.entrySet()) {
            GraphEdge other = right.get(entry.getKey());
            if (other == null) {
                continue;
            }
            double weightA = metric.weight(entry.getValue().aggregate());
            double weightB = metric.weight(other.aggregate());
            if (weightA != 0.0 && weightB != 0.0) {
                shared.add(new SharedCounterparty(entry.getKey(), weightA, weightB));
            }
        }
        return shared;
    }

    public GraphStats stats() {
        int vendors = 0;
        int agencies = 0;
        long vendorDegrees = 0;
        long agencyDegrees = 0;
        for (NodeId node : nodes) {
            if (node.isVendor()) {
                vendors++;
                vendorDegrees += degree(node);
            } else {
                agencies++;
                agencyDegrees += degree(node);
            }
        }
        int transactionEdges = 0;
        for (GraphEdge edge : edges) {
            if (edge.isTransaction()) {
                transactionEdges++;
            }
        }
        return new GraphStats(
                vendors,
                agencies,
                transactionEdges,
                edges.size() - transactionEdges,
                connectedComponents(GraphEdge::isTransaction).size(),
                vendors == 0 ? 0.0 : (double) vendorDegrees / vendors,
                agencies == 0 ? 0.0 : (double) agencyDegrees / agencies);
    }
}
