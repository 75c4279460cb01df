package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.graph.BipartiteGraph;
import com.spending.fraud.graph.Component;
import com.spending.fraud.graph.DegreeOutlier;
import com.spending.fraud.graph.EdgeShare;
import com.spending.fraud.graph.GraphEdge;
import com.spending.fraud.graph.NodeId;
import com.spending.fraud.graph.NodeKind;
import com.spending.fraud.graph.PaymentAggregate;
import com.spending.fraud.graph.WeightMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Structural analysis of the vendor/agency graph: hub vendors serving unusually many
 * agencies, clusters of related vendors sharing agencies, and agencies whose spending is
 * dominated by one vendor.
 */
public class NetworkAnalysisRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisRule.class);

    public static final String NAME = "network";

    static final int MIN_NODES = 10;
    static final int HUB_MIN_DEGREE = 10;
    static final double HUB_Z = 2.0;
    static final int CLUSTER_MIN = 3;
    static final int CLUSTER_MAX = 20;
    static final double EXCLUSIVE_MIN_TOTAL = 100_000;
    static final double EXCLUSIVE_MIN_SHARE = 0.80;

    public record AgencyLink(long id, String name, double paymentTotal, long contractCount) {
    }

    public record HubEvidence(long vendorId, String vendorName, int agencyCount, double meanVendorAgencies,
                              double totalValue, List<AgencyLink> agencies) implements AlertEvidence {
    }

    public record ClusterVendor(long id, String name, String vendorCode) {
    }

    public record CommonAgency(long id, String name, int vendorCount) {
    }

    public record ClusterEvidence(int vendorCount, List<ClusterVendor> vendors, List<CommonAgency> commonAgencies,
                                  double totalValue) implements AlertEvidence {
    }

    public record ExclusiveEvidence(long agencyId, String agencyName, long topVendorId, String topVendorName,
                                    double topVendorShare, double topVendorValue, double totalValue,
                                    int vendorCount) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Network Analysis";
    }

    @Override
    public boolean requiresGraph() {
        return true;
    }

    @Override
    public int detect(DetectionContext context) {
        BipartiteGraph graph = context.graph();
        if (graph.nodeCount() < MIN_NODES) {
            log.info("network.skipped nodes={} reason=insufficient_data", graph.nodeCount());
            return 0;
        }
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());

        return detectHubVendors(context, graph, vendors, agencies)
                + detectIsolatedClusters(context, graph, vendors, agencies)
                + detectExclusiveRelationships(context, graph, vendors, agencies);
    }

    int detectHubVendors(DetectionContext context, BipartiteGraph graph,
                         Map<Long, CanonicalEntity> vendors, Map<Long, CanonicalEntity> agencies) {
        int alerts = 0;
        for (DegreeOutlier outlier : graph.degreeOutliers(NodeKind.VENDOR, HUB_MIN_DEGREE, HUB_Z)) {
            NodeId vendorNode = outlier.node();
            CanonicalEntity vendor = vendors.get(vendorNode.id());
            if (vendor == null) {
                continue;
            }
            List<AgencyLink> links = new ArrayList<>();
            for (Map.Entry<NodeId, PaymentAggregate> entry : graph.transactionNeighbors(vendorNode).entrySet()) {
                PaymentAggregate aggregate = entry.getValue();
                links.add(new AgencyLink(entry.getKey().id(),
                        RuleSupport.nameOf(agencies, entry.getKey().id(), null),
                        aggregate.paymentTotal(), aggregate.contractCount()));
            }
            links.sort(Comparator.comparingDouble(AgencyLink::paymentTotal).reversed()
                    .thenComparingLong(AgencyLink::id));
            double totalValue = graph.weight(vendorNode, WeightMetric.TOTAL_VALUE);

            AlertSeverity severity = outlier.degree() >= outlier.mean() + 3 * outlier.stddev()
                    ? AlertSeverity.MEDIUM
                    : AlertSeverity.LOW;
            String description = String.format(Locale.US,
                    "Vendor '%s' has relationships with %d agencies (average vendor: %.1f agencies). "
                            + "Total value: %s. This high connectivity may warrant review.",
                    vendor.label(), outlier.degree(), outlier.mean(), RuleSupport.money(totalValue));
            alerts += context.raise(new AlertRequest("hub_vendor", severity, "Hub vendor: " + vendor.label(),
                    description, EntityKind.VENDOR, vendor.getId(),
                    new HubEvidence(vendor.getId(), vendor.label(), outlier.degree(),
                            RuleSupport.round(outlier.mean(), 1), totalValue,
                            links.subList(0, Math.min(20, links.size())))));
        }
        return alerts;
    }

    int detectIsolatedClusters(DetectionContext context, BipartiteGraph graph,
                               Map<Long, CanonicalEntity> vendors, Map<Long, CanonicalEntity> agencies) {
        int alerts = 0;
        for (Component component : graph.connectedComponents(GraphEdge::isRelationship)) {
            List<NodeId> members = component.vendors();
            if (members.size() < CLUSTER_MIN || members.size() > CLUSTER_MAX) {
                continue;
            }

            Map<NodeId, Integer> agencyCounts = new TreeMap<>();
            double totalValue = 0.0;
            for (NodeId vendorNode : members) {
                for (Map.Entry<NodeId, PaymentAggregate> entry : graph.transactionNeighbors(vendorNode).entrySet()) {
                    agencyCounts.merge(entry.getKey(), 1, Integer::sum);
                    totalValue += entry.getValue().paymentTotal();
                }
            }
            List<CommonAgency> common = new ArrayList<>();
            agencyCounts.forEach((agency, count) -> {
                if (count >= 2) {
                    common.add(new CommonAgency(agency.id(), RuleSupport.nameOf(agencies, agency.id(), null), count));
                }
            });
            if (common.isEmpty()) {
                continue;
            }

            List<ClusterVendor> clusterVendors = new ArrayList<>();
            for (NodeId vendorNode : members) {
                CanonicalEntity vendor = vendors.get(vendorNode.id());
                clusterVendors.add(new ClusterVendor(vendorNode.id(),
                        vendor != null ? vendor.label() : vendorNode.toString(),
                        vendor != null ? vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE) : null));
            }

            AlertSeverity severity = members.size() >= 5 && totalValue >= 1_000_000
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "Found cluster of %d related vendors sharing %d common agencies. "
                            + "Total combined payments: %s. This pattern may indicate coordinated activity.",
                    members.size(), common.size(), RuleSupport.money(totalValue));
            alerts += context.raise(new AlertRequest("vendor_cluster", severity,
                    "Related vendor cluster (" + members.size() + " vendors)", description,
                    EntityKind.VENDOR, members.get(0).id(),
                    new ClusterEvidence(members.size(), clusterVendors, common, totalValue)));
        }
        return alerts;
    }

    int detectExclusiveRelationships(DetectionContext context, BipartiteGraph graph,
                                     Map<Long, CanonicalEntity> vendors, Map<Long, CanonicalEntity> agencies) {
        int alerts = 0;
        for (NodeId agencyNode : graph.nodes(NodeKind.AGENCY)) {
            Optional<EdgeShare> dominant = graph.dominantEdgeShare(agencyNode, WeightMetric.PAYMENT_TOTAL);
            if (dominant.isEmpty()) {
                continue;
            }
            EdgeShare share = dominant.get();
            if (share.totalWeight() < EXCLUSIVE_MIN_TOTAL || share.share() < EXCLUSIVE_MIN_SHARE) {
                continue;
            }
            CanonicalEntity agency = agencies.get(agencyNode.id());
            if (agency == null) {
                continue;
            }
            String topVendorName = RuleSupport.nameOf(vendors, share.topNeighbor().id(), "Unknown");

            AlertSeverity severity = share.share() >= 0.95 || share.topWeight() >= 5_000_000
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "%s directs %s of spending (%s) to '%s'. Total spending: %s across %d vendors.",
                    agency.label(), RuleSupport.percent(share.share()), RuleSupport.money(share.topWeight()),
                    topVendorName, RuleSupport.money(share.totalWeight()), share.neighborCount());
            alerts += context.raise(new AlertRequest("exclusive_relationship", severity,
                    "Agency spending concentration: " + agency.label(), description,
                    EntityKind.AGENCY, agency.getId(),
                    new ExclusiveEvidence(agency.getId(), agency.label(), share.topNeighbor().id(), topVendorName,
                            RuleSupport.round(share.share() * 100, 1), share.topWeight(), share.totalWeight(),
                            share.neighborCount())));
        }
        return alerts;
    }
}
