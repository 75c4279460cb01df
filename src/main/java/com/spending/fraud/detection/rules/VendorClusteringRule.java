package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.matching.CandidatePair;
import com.spending.fraud.matching.MatchingResult;
import com.spending.fraud.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds vendors that may be one entity or a set of shell companies: several vendors at one
 * address, near-identical names at different addresses, and consecutive vendor codes with
 * similar names. Discovered links are recorded in the relationship store for later rules.
 */
public class VendorClusteringRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(VendorClusteringRule.class);

    public static final String NAME = "vendor_clustering";

    static final double SAME_ADDRESS_CONFIDENCE = 0.8;
    static final double SAME_ADDRESS_NAME_SKIP = 0.9;
    static final int ADDRESS_CLUSTER_MIN = 3;
    static final double NAME_ALERT_MIN = 0.9;
    static final double SEQUENTIAL_RECORD_MIN = 0.7;
    static final double SEQUENTIAL_ALERT_MIN = 0.85;

    public record VendorSummary(long id, String name, String vendorCode, double paymentTotal) {
    }

    public record AddressClusterEvidence(String address, int vendorCount, List<VendorSummary> vendors,
                                         double totalPayments) implements AlertEvidence {
    }

    public record VendorAddress(long id, String name, String address) {
    }

    public record SimilarNameEvidence(VendorAddress vendor1, VendorAddress vendor2, double similarity)
            implements AlertEvidence {
    }

    public record SequentialIdEvidence(VendorSummary vendor1, VendorSummary vendor2, double similarity)
            implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Vendor Clustering";
    }

    @Override
    public int detect(DetectionContext context) {
        List<CanonicalEntity> vendors = context.data().vendors();
        double threshold = context.thresholds().getDouble("vendor_name_similarity", 0.85);
        log.info("vendor_clustering.start vendors={} threshold={}", vendors.size(), threshold);

        int alerts = detectSameAddress(context, vendors);
        alerts += detectSimilarNames(context, vendors, threshold);
        alerts += detectSequentialIds(context, vendors);
        return alerts;
    }

    int detectSameAddress(DetectionContext context, List<CanonicalEntity> vendors) {
        SimilarityAlgorithm similarity = context.matchingEngine().getSimilarity();
        Map<String, List<CanonicalEntity>> groups = new TreeMap<>();
        for (CanonicalEntity vendor : vendors) {
            if (vendor.hasNormalizedAddress()) {
                groups.computeIfAbsent(vendor.getNormalizedAddress(), k -> new ArrayList<>()).add(vendor);
            }
        }

        int alerts = 0;
        for (Map.Entry<String, List<CanonicalEntity>> entry : groups.entrySet()) {
            List<CanonicalEntity> group = entry.getValue();
            if (group.size() < 2) {
                continue;
            }
            group.sort(Comparator.comparingLong(CanonicalEntity::getId));
            if (group.size() == 2
                    && similarity.compute(nameOf(group.get(0)), nameOf(group.get(1))) > SAME_ADDRESS_NAME_SKIP) {
                // near-identical names at one address are most likely one vendor entered twice
                continue;
            }

            String address = entry.getKey();
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    context.store().upsert(new RelationshipEdge(group.get(i).ref(), group.get(j).ref(),
                            RelationType.SAME_ADDRESS, SAME_ADDRESS_CONFIDENCE, Map.of("address", address)));
                }
            }

            if (group.size() >= ADDRESS_CLUSTER_MIN) {
                alerts += context.raise(addressClusterAlert(context, address, group));
            }
        }
        return alerts;
    }

    private AlertRequest addressClusterAlert(DetectionContext context, String address, List<CanonicalEntity> group) {
        List<VendorSummary> summaries = new ArrayList<>(group.size());
        double total = 0.0;
        for (CanonicalEntity vendor : group) {
            double paid = context.vendorPaymentTotal(vendor.getId());
            total += paid;
            summaries.add(summary(vendor, paid));
        }
        AlertSeverity severity = group.size() >= 5 || total >= 1_000_000
                ? AlertSeverity.HIGH
                : AlertSeverity.MEDIUM;
        String description = String.format(Locale.US,
                "Found %d different vendors registered at '%s'. Combined payments: %s. "
                        + "This may indicate shell companies or related party transactions.",
                group.size(), address, RuleSupport.money(total));
        return new AlertRequest("vendor_cluster_address", severity,
                group.size() + " vendors at same address", description,
                EntityKind.VENDOR, group.get(0).getId(),
                new AddressClusterEvidence(address, group.size(), summaries, total));
    }

    int detectSimilarNames(DetectionContext context, List<CanonicalEntity> vendors, double threshold) {
        MatchingResult result = context.matchingEngine().match(vendors, context.matchingOptions(threshold));
        if (!result.isComplete()) {
            log.warn("vendor_clustering.partial_matching failedBatches={}", result.failedBatches());
        }
        Map<Long, CanonicalEntity> byId = RuleSupport.byId(vendors);

        context.relationshipMatcher().record(result.pairs(), RelationType.SIMILAR_NAME, pair -> {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("name1", RuleSupport.nameOf(byId, pair.first().id(), pair.first().toString()));
            evidence.put("name2", RuleSupport.nameOf(byId, pair.second().id(), pair.second().toString()));
            evidence.put("similarity", pair.score());
            return evidence;
        });

        int alerts = 0;
        for (CandidatePair pair : result.pairs()) {
            if (pair.score() < NAME_ALERT_MIN) {
                continue;
            }
            CanonicalEntity v1 = byId.get(pair.first().id());
            CanonicalEntity v2 = byId.get(pair.second().id());
            if (v1 == null || v2 == null || !v1.hasNormalizedAddress() || !v2.hasNormalizedAddress()
                    || v1.getNormalizedAddress().equals(v2.getNormalizedAddress())) {
                continue;
            }
            String description = String.format(Locale.US,
                    "Vendors '%s' and '%s' have %s name similarity but different addresses. "
                            + "May be the same entity or intentional duplicates.",
                    v1.label(), v2.label(), RuleSupport.percent(pair.score()));
            alerts += context.raise(new AlertRequest("vendor_cluster_name", AlertSeverity.MEDIUM,
                    "Nearly identical vendor names", description, EntityKind.VENDOR, v1.getId(),
                    new SimilarNameEvidence(vendorAddress(v1), vendorAddress(v2), pair.score())));
        }
        return alerts;
    }

    int detectSequentialIds(DetectionContext context, List<CanonicalEntity> vendors) {
        SimilarityAlgorithm similarity = context.matchingEngine().getSimilarity();
        TreeMap<Long, CanonicalEntity> byCode = new TreeMap<>();
        for (CanonicalEntity vendor : vendors) {
            Long code = numericCode(vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE));
            if (code != null) {
                byCode.putIfAbsent(code, vendor);
            }
        }

        int alerts = 0;
        for (Map.Entry<Long, CanonicalEntity> entry : byCode.entrySet()) {
            CanonicalEntity next = byCode.get(entry.getKey() + 1);
            if (next == null) {
                continue;
            }
            CanonicalEntity v1 = entry.getValue();
            double score = similarity.compute(nameOf(v1), nameOf(next));
            if (score < SEQUENTIAL_RECORD_MIN) {
                continue;
            }
            Map<String, Object> edgeEvidence = new LinkedHashMap<>();
            edgeEvidence.put("vendor_id_1", v1.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE));
            edgeEvidence.put("vendor_id_2", next.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE));
            edgeEvidence.put("name_similarity", score);
            context.store().upsert(new RelationshipEdge(v1.ref(), next.ref(), RelationType.SEQUENTIAL_ID,
                    score, edgeEvidence));

            if (score >= SEQUENTIAL_ALERT_MIN) {
                String description = String.format(Locale.US,
                        "Vendors '%s' (%s) and '%s' (%s) have sequential IDs and %s name similarity. "
                                + "May indicate coordinated registration.",
                        v1.label(), v1.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE),
                        next.label(), next.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE),
                        RuleSupport.percent(score));
                alerts += context.raise(new AlertRequest("vendor_cluster_sequential", AlertSeverity.LOW,
                        "Sequential vendor IDs with similar names", description, EntityKind.VENDOR, v1.getId(),
                        new SequentialIdEvidence(summary(v1, context.vendorPaymentTotal(v1.getId())),
                                summary(next, context.vendorPaymentTotal(next.getId())), score)));
            }
        }
        return alerts;
    }

    static Long numericCode(String code) {
        if (code == null) {
            return null;
        }
        String digits = code.replace("-", "").replace(" ", "");
        if (digits.isEmpty() || digits.length() > 18 || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return Long.parseLong(digits);
    }

    private static String nameOf(CanonicalEntity vendor) {
        return vendor.hasNormalizedName() ? vendor.getNormalizedName() : vendor.label();
    }

    private static VendorSummary summary(CanonicalEntity vendor, double paid) {
        return new VendorSummary(vendor.getId(), vendor.label(),
                vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE), paid);
    }

    private static VendorAddress vendorAddress(CanonicalEntity vendor) {
        String raw = vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS);
        return new VendorAddress(vendor.getId(), vendor.label(), raw != null ? raw : vendor.getNormalizedAddress());
    }
}
