package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.data.ContributionRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.graph.BipartiteGraph;
import com.spending.fraud.graph.Component;
import com.spending.fraud.graph.GraphBuilder;
import com.spending.fraud.graph.GraphEdge;
import com.spending.fraud.graph.NodeId;
import com.spending.fraud.graph.SharedCounterparty;
import com.spending.fraud.graph.WeightMetric;
import com.spending.fraud.matching.CandidatePair;
import com.spending.fraud.matching.MatchingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Related-party analysis over the recorded relationships: networks of linked vendors with
 * significant combined payments, employee-vendor links where the vendor also makes campaign
 * contributions, and related vendors paid by the same agencies.
 *
 * <p>The vendor graph is rebuilt from the store when the rule starts, so relationships
 * recorded earlier in the same run are included.</p>
 */
public class RelatedPartyRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(RelatedPartyRule.class);

    public static final String NAME = "related_party";

    static final double CONTRIBUTOR_SIMILARITY = 0.80;
    static final int CONTRIBUTOR_CANDIDATES = 5;
    static final double CIRCULAR_MIN_CONFIDENCE = 0.7;
    static final double CIRCULAR_MIN_TOTAL = 50_000;

    public record NetworkVendor(long id, String name, String vendorCode, String address,
                                double totalPayments, long paymentCount) {
    }

    public record NetworkEvidence(int networkSize, double totalNetworkValue, List<NetworkVendor> vendors,
                                  Map<String, Integer> relationshipTypes, int relationshipCount)
            implements AlertEvidence {
    }

    public record Recipient(String name, BigDecimal amount) {
    }

    public record TriangleEvidence(long employeeId, String employeeName, String employeeAgency, String employeeTitle,
                                   long vendorId, String vendorName, String matchType, double matchConfidence,
                                   double vendorPayments, long paymentCount, int contributionCount,
                                   BigDecimal totalContributions, List<Recipient> contributionRecipients)
            implements AlertEvidence {
    }

    public record SharedAgency(long id, String name, double vendor1Payments, double vendor2Payments) {
    }

    public record CircularEvidence(long vendor1Id, String vendor1Name, long vendor2Id, String vendor2Name,
                                   String relationshipType, double relationshipConfidence, int commonAgencyCount,
                                   double vendor1Total, double vendor2Total, List<SharedAgency> agencies)
            implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Related Party";
    }

    @Override
    public int detect(DetectionContext context) {
        int minSize = context.thresholds().getInt("related_party_min_network_size", 3);
        double minValue = context.thresholds().getDouble("related_party_min_value", 500_000);

        List<RelationshipEdge> vendorEdges = context.store().queryBetween(EntityKind.VENDOR, EntityKind.VENDOR);
        BipartiteGraph graph = GraphBuilder.build(context.data().paymentAggregates(), vendorEdges);
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        log.info("related_party.start vendorEdges={} minSize={} minValue={}", vendorEdges.size(), minSize, minValue);

        return detectVendorNetworks(context, graph, vendorEdges, vendors, minSize, minValue)
                + detectContributorTriangles(context, vendors)
                + detectCircularPatterns(context, graph, vendorEdges, vendors);
    }

    int detectVendorNetworks(DetectionContext context, BipartiteGraph graph, List<RelationshipEdge> vendorEdges,
                             Map<Long, CanonicalEntity> vendors, int minSize, double minValue) {
        int alerts = 0;
        for (Component component : graph.connectedComponents(GraphEdge::isRelationship)) {
            List<NodeId> members = component.vendors();
            if (members.size() < minSize) {
                continue;
            }
            double networkValue = 0.0;
            List<NetworkVendor> details = new ArrayList<>(members.size());
            Set<Long> memberIds = new TreeSet<>();
            for (NodeId node : members) {
                memberIds.add(node.id());
                CanonicalEntity vendor = vendors.get(node.id());
                double paid = context.vendorPaymentTotal(node.id());
                networkValue += paid;
                details.add(new NetworkVendor(node.id(), vendor != null ? vendor.label() : node.toString(),
                        vendor != null ? vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE) : null,
                        vendor != null ? vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS) : null,
                        paid, context.vendorPaymentCount(node.id())));
            }
            if (networkValue < minValue) {
                continue;
            }

            Map<String, Integer> relationTypes = new TreeMap<>();
            int relationCount = 0;
            for (RelationshipEdge edge : vendorEdges) {
                if (memberIds.contains(edge.entityId1()) && memberIds.contains(edge.entityId2())) {
                    relationTypes.merge(edge.relationType().getCode(), 1, Integer::sum);
                    relationCount++;
                }
            }

            AlertSeverity severity = networkSeverity(members.size(), networkValue, relationTypes.size());
            String relations = relationTypes.entrySet().stream()
                    .map(e -> e.getKey() + "(" + e.getValue() + ")")
                    .collect(Collectors.joining(", "));
            String description = String.format(Locale.US,
                    "Found network of %d related vendors with combined payments of %s. Relationships: %s. "
                            + "This network may indicate coordinated activity, shell companies, or bid rigging.",
                    members.size(), RuleSupport.money(networkValue), relations);
            alerts += context.raise(new AlertRequest("related_party_network", severity,
                    String.format(Locale.US, "Related party network (%d vendors, %s)",
                            members.size(), RuleSupport.wholeMoney(networkValue)),
                    description, EntityKind.VENDOR, members.get(0).id(),
                    new NetworkEvidence(members.size(), networkValue, details, relationTypes, relationCount)));
        }
        return alerts;
    }

    static AlertSeverity networkSeverity(int size, double value, int relationTypeCount) {
        if (size >= 5 || value >= 2_000_000 || relationTypeCount >= 3) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.MEDIUM;
    }

    int detectContributorTriangles(DetectionContext context, Map<Long, CanonicalEntity> vendors) {
        List<RelationshipEdge> links = context.store().queryBetween(EntityKind.EMPLOYEE, EntityKind.VENDOR);
        List<ContributionRecord> contributions = context.data().contributions();
        if (links.isEmpty() || contributions.isEmpty()) {
            return 0;
        }

        Map<Long, List<ContributionRecord>> byContributor = new HashMap<>();
        for (ContributionRecord c : contributions) {
            byContributor.computeIfAbsent(c.contributorId(), k -> new ArrayList<>()).add(c);
        }
        List<CanonicalEntity> contributors = context.data().contributors().stream()
                .filter(c -> byContributor.containsKey(c.getId()))
                .toList();
        Map<Long, CanonicalEntity> employees = RuleSupport.byId(context.data().employees());

        Map<Long, CanonicalEntity> linkedVendors = new TreeMap<>();
        for (RelationshipEdge link : links) {
            EntityRef vendorRef = vendorEnd(link);
            CanonicalEntity vendor = vendors.get(vendorRef.id());
            if (vendor != null) {
                linkedVendors.put(vendor.getId(), vendor);
            }
        }

        MatchingOptions options = context.matchingOptions().toBuilder()
                .threshold(CONTRIBUTOR_SIMILARITY)
                .maxCandidatesPerItem(CONTRIBUTOR_CANDIDATES)
                .build();
        Map<Long, List<CandidatePair>> contributorMatches = new HashMap<>();
        for (CandidatePair pair : context.matchingEngine()
                .match(new ArrayList<>(linkedVendors.values()), contributors, options).pairs()) {
            contributorMatches.computeIfAbsent(pair.first().id(), k -> new ArrayList<>()).add(pair);
        }

        int alerts = 0;
        for (RelationshipEdge link : links) {
            EntityRef vendorRef = vendorEnd(link);
            CanonicalEntity employee = employees.get(link.other(vendorRef).id());
            CanonicalEntity vendor = vendors.get(vendorRef.id());
            List<CandidatePair> matches = contributorMatches.getOrDefault(vendorRef.id(), List.of());
            double paid = context.vendorPaymentTotal(vendorRef.id());
            if (employee == null || vendor == null || matches.isEmpty() || paid <= 0.0) {
                continue;
            }

            List<ContributionRecord> matched = matches.stream()
                    .sorted(Comparator.comparingDouble(CandidatePair::score).reversed()
                            .thenComparing(CandidatePair::second))
                    .limit(CONTRIBUTOR_CANDIDATES)
                    .flatMap(p -> byContributor.getOrDefault(p.second().id(), List.of()).stream())
                    .toList();
            BigDecimal total = BigDecimal.ZERO;
            Map<String, BigDecimal> recipients = new TreeMap<>();
            for (ContributionRecord c : matched) {
                total = total.add(c.amount());
                recipients.merge(c.filerName() != null ? c.filerName() : "Unknown", c.amount(), BigDecimal::add);
            }
            List<Recipient> topRecipients = recipients.entrySet().stream()
                    .map(e -> new Recipient(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparing(Recipient::amount).reversed())
                    .limit(10)
                    .toList();

            AlertSeverity severity = total.compareTo(new BigDecimal("10000")) >= 0 || paid >= 500_000
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "Employee '%s' is linked to vendor '%s' (match type: %s, confidence: %s). "
                            + "The vendor has received %s in payments and appears to have made %s in campaign "
                            + "contributions. This triangular relationship warrants investigation for potential "
                            + "conflicts of interest or pay-to-play schemes.",
                    employee.label(), vendor.label(), link.relationType().getCode(),
                    RuleSupport.percent(link.confidence()), RuleSupport.money(paid),
                    RuleSupport.money(total.doubleValue()));
            alerts += context.raise(new AlertRequest("employee_vendor_contributor_triangle", severity,
                    "Employee-vendor-contributor link: " + employee.label(), description,
                    EntityKind.EMPLOYEE, employee.getId(),
                    new TriangleEvidence(employee.getId(), employee.label(),
                            employee.stringAttribute(CanonicalEntity.ATTR_AGENCY_NAME),
                            employee.stringAttribute(CanonicalEntity.ATTR_JOB_TITLE),
                            vendor.getId(), vendor.label(), link.relationType().getCode(), link.confidence(),
                            paid, context.vendorPaymentCount(vendor.getId()), matched.size(), total,
                            topRecipients)));
        }
        return alerts;
    }

    private static EntityRef vendorEnd(RelationshipEdge link) {
        return link.first().kind() == EntityKind.VENDOR ? link.first() : link.second();
    }

    int detectCircularPatterns(DetectionContext context, BipartiteGraph graph, List<RelationshipEdge> vendorEdges,
                               Map<Long, CanonicalEntity> vendors) {
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());
        int alerts = 0;
        for (RelationshipEdge edge : vendorEdges) {
            if (edge.confidence() < CIRCULAR_MIN_CONFIDENCE) {
                continue;
            }
            CanonicalEntity v1 = vendors.get(edge.entityId1());
            CanonicalEntity v2 = vendors.get(edge.entityId2());
            if (v1 == null || v2 == null) {
                continue;
            }
            List<SharedCounterparty> shared = graph.sharedCounterparties(
                    NodeId.vendor(v1.getId()), NodeId.vendor(v2.getId()), WeightMetric.PAYMENT_TOTAL);
            if (shared.isEmpty()) {
                continue;
            }
            double total1 = 0.0;
            double total2 = 0.0;
            List<SharedAgency> details = new ArrayList<>(shared.size());
            for (SharedCounterparty s : shared) {
                total1 += s.weightA();
                total2 += s.weightB();
                details.add(new SharedAgency(s.counterparty().id(),
                        RuleSupport.nameOf(agencies, s.counterparty().id(), null), s.weightA(), s.weightB()));
            }
            if (total1 < CIRCULAR_MIN_TOTAL || total2 < CIRCULAR_MIN_TOTAL) {
                continue;
            }

            AlertSeverity severity = shared.size() >= 3 || total1 + total2 >= 1_000_000
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "Related vendors '%s' and '%s' (%s) both receive payments from %d common agencies. "
                            + "Vendor 1: %s, Vendor 2: %s. This pattern may indicate bid rotation, market "
                            + "allocation, or coordinated fraud.",
                    v1.label(), v2.label(), edge.relationType().getCode(), shared.size(),
                    RuleSupport.money(total1), RuleSupport.money(total2));
            alerts += context.raise(new AlertRequest("circular_payment_pattern", severity,
                    "Circular payment pattern: " + v1.label() + " & " + v2.label(), description,
                    EntityKind.VENDOR, v1.getId(),
                    new CircularEvidence(v1.getId(), v1.label(), v2.getId(), v2.label(),
                            edge.relationType().getCode(), edge.confidence(), shared.size(), total1, total2,
                            details)));
        }
        return alerts;
    }
}
