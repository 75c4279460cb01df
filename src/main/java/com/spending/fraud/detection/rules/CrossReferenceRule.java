package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.data.ContractRecord;
import com.spending.fraud.data.ContributionRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.matching.CandidatePair;
import com.spending.fraud.matching.MatchingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cross-dataset checks: many vendors operating from one address, campaign contributors
 * who are also paid vendors, and in-state vendors outside the CMBL with no tax permit.
 */
public class CrossReferenceRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceRule.class);

    public static final String NAME = "crossref";
    public static final String ADDRESS_CLUSTER = "address_cluster";
    public static final String PAY_TO_PLAY = "pay_to_play";
    public static final String UNREGISTERED = GhostVendorRule.GHOST_VENDOR;

    static final int ADDRESS_CLUSTER_MIN = 3;
    static final int EVIDENCE_LIST_MAX = 10;
    static final BigDecimal CONTRIBUTION_MIN_EACH = new BigDecimal("500");
    static final String HOME_STATE = "TX";

    record Donor(CanonicalEntity representative, BigDecimal total, Set<String> recipients) {
    }

    public record AddressClusterEvidence(String address, String city, String state, int vendorCount,
                                         List<String> vendorNames, List<String> vendorIds, double totalPayments,
                                         double totalContracts) implements AlertEvidence {
    }

    public record PayToPlayEvidence(String contributorName, String vendorName, double totalContributions,
                                    List<String> recipients, double vendorPayments, double vendorContracts,
                                    double matchScore, double roi) implements AlertEvidence {
    }

    public record UnregisteredEvidence(String vendorName, String vendorId, String address, String city, String state,
                                       double totalPayments, boolean inCmbl, boolean hasTaxPermit)
            implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Cross-Reference";
    }

    @Override
    public int detect(DetectionContext context) {
        List<CanonicalEntity> vendors = new ArrayList<>(context.data().vendors());
        vendors.sort(Comparator.comparingLong(CanonicalEntity::getId));
        Map<Long, Double> contractTotals = contractTotals(context.data().contracts());
        log.info("crossref.start vendors={} contracts={}", vendors.size(), context.data().contracts().size());

        int alerts = detectAddressClusters(context, vendors, contractTotals);
        alerts += detectPayToPlay(context, vendors, contractTotals);
        alerts += detectUnregistered(context, vendors);
        return alerts;
    }

    int detectAddressClusters(DetectionContext context, List<CanonicalEntity> vendors, Map<Long, Double> contractTotals) {
        Map<String, List<CanonicalEntity>> groups = new TreeMap<>();
        for (CanonicalEntity vendor : vendors) {
            if (vendor.hasNormalizedAddress()) {
                groups.computeIfAbsent(vendor.getNormalizedAddress(), k -> new ArrayList<>()).add(vendor);
            }
        }

        int alerts = 0;
        for (Map.Entry<String, List<CanonicalEntity>> entry : groups.entrySet()) {
            List<CanonicalEntity> group = entry.getValue();
            if (group.size() < ADDRESS_CLUSTER_MIN) {
                continue;
            }
            CanonicalEntity first = group.get(0);
            double payments = 0.0;
            double contracts = 0.0;
            for (CanonicalEntity vendor : group) {
                payments += context.vendorPaymentTotal(vendor.getId());
                contracts += contractTotals.getOrDefault(vendor.getId(), 0.0);
            }
            double combined = payments + contracts;
            String address = first.stringAttribute(CanonicalEntity.ATTR_ADDRESS);
            if (address == null) {
                address = entry.getKey();
            }
            String city = first.stringAttribute(CanonicalEntity.ATTR_CITY);
            String state = first.stringAttribute(CanonicalEntity.ATTR_STATE);
            List<CanonicalEntity> listed = group.subList(0, Math.min(EVIDENCE_LIST_MAX, group.size()));

            String description = String.format(Locale.US,
                    "Found %d vendors operating from the same address: %s. Combined spending: %s",
                    group.size(), location(address, city, state), RuleSupport.wholeMoney(combined));
            alerts += context.raise(new AlertRequest(ADDRESS_CLUSTER, clusterSeverity(combined),
                    group.size() + " vendors share address: " + RuleSupport.truncate(address, 40), description,
                    EntityKind.VENDOR, first.getId(),
                    new AddressClusterEvidence(address, city, state, group.size(),
                            listed.stream().map(CanonicalEntity::label).toList(),
                            listed.stream().map(v -> v.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE)).toList(),
                            payments, contracts)));
        }
        return alerts;
    }

    int detectPayToPlay(DetectionContext context, List<CanonicalEntity> vendors, Map<Long, Double> contractTotals) {
        double minContribution = context.thresholds().getDouble("min_contribution_for_alert", 5000);
        double threshold = context.thresholds().getDouble("name_match_threshold", 0.90);
        Map<Long, Donor> donors = donors(context, minContribution);
        if (donors.isEmpty()) {
            log.info("crossref.pay_to_play.skipped reason=no_significant_contributors");
            return 0;
        }

        List<CanonicalEntity> representatives = donors.values().stream().map(Donor::representative).toList();
        MatchingResult result = context.matchingEngine().match(vendors, representatives,
                context.matchingOptions(threshold));
        if (!result.isComplete()) {
            log.warn("crossref.partial_matching failedBatches={}", result.failedBatches());
        }

        Map<Long, CanonicalEntity> vendorIndex = RuleSupport.byId(vendors);
        Map<Long, CandidatePair> bestByVendor = new TreeMap<>();
        for (CandidatePair pair : result.pairs()) {
            CanonicalEntity vendor = vendorIndex.get(pair.first().id());
            Donor donor = donors.get(pair.second().id());
            if (vendor == null || donor == null) {
                continue;
            }
            Map<String, Object> edgeEvidence = new LinkedHashMap<>();
            edgeEvidence.put("match_type", "pay_to_play");
            edgeEvidence.put("score", pair.score());
            context.store().upsert(new RelationshipEdge(vendor.ref(), donor.representative().ref(), RelationType.NAME,
                    pair.score(), edgeEvidence));
            bestByVendor.merge(vendor.getId(), pair, (a, b) -> a.score() >= b.score() ? a : b);
        }

        int alerts = 0;
        for (CandidatePair pair : bestByVendor.values()) {
            CanonicalEntity vendor = vendorIndex.get(pair.first().id());
            Donor donor = donors.get(pair.second().id());
            double given = donor.total().doubleValue();
            double payments = context.vendorPaymentTotal(vendor.getId());
            double contracts = contractTotals.getOrDefault(vendor.getId(), 0.0);
            double roi = given > 0 ? (payments + contracts) / given : 0.0;
            String contributorName = donor.representative().getNormalizedName();

            String description = String.format(Locale.US,
                    "Campaign contributor '%s' (%s donated) matches vendor '%s' (%s in state business). ROI: %.1fx",
                    contributorName, RuleSupport.wholeMoney(given), vendor.label(),
                    RuleSupport.wholeMoney(payments + contracts), roi);
            alerts += context.raise(new AlertRequest(PAY_TO_PLAY, roiSeverity(roi),
                    "Campaign contributor is state vendor: " + RuleSupport.truncate(vendor.label(), 30), description,
                    EntityKind.VENDOR, vendor.getId(),
                    new PayToPlayEvidence(contributorName, vendor.label(), given,
                            donor.recipients().stream().limit(EVIDENCE_LIST_MAX).toList(), payments, contracts,
                            RuleSupport.round(pair.score(), 4), RuleSupport.round(roi, 2))));
        }
        return alerts;
    }

    /**
     * Contributors grouped by normalized name, keyed by the lowest contributor id in the
     * group. Contributions under the per-gift minimum are ignored.
     */
    static Map<Long, Donor> donors(DetectionContext context, double minContribution) {
        Map<Long, CanonicalEntity> contributors = RuleSupport.byId(context.data().contributors());
        Map<String, List<ContributionRecord>> byName = new TreeMap<>();
        Map<String, CanonicalEntity> representative = new HashMap<>();
        for (ContributionRecord contribution : context.data().contributions()) {
            CanonicalEntity contributor = contributors.get(contribution.contributorId());
            if (contributor == null || !contributor.hasNormalizedName()
                    || contribution.amount().compareTo(CONTRIBUTION_MIN_EACH) < 0) {
                continue;
            }
            String key = contributor.getNormalizedName();
            byName.computeIfAbsent(key, k -> new ArrayList<>()).add(contribution);
            representative.merge(key, contributor, (a, b) -> a.getId() <= b.getId() ? a : b);
        }

        Map<Long, Donor> donors = new TreeMap<>();
        for (Map.Entry<String, List<ContributionRecord>> entry : byName.entrySet()) {
            BigDecimal total = BigDecimal.ZERO;
            Set<String> recipients = new TreeSet<>();
            for (ContributionRecord contribution : entry.getValue()) {
                total = total.add(contribution.amount());
                if (contribution.filerName() != null) {
                    recipients.add(contribution.filerName());
                }
            }
            if (total.doubleValue() >= minContribution) {
                CanonicalEntity rep = representative.get(entry.getKey());
                donors.put(rep.getId(), new Donor(rep, total, recipients));
            }
        }
        return donors;
    }

    int detectUnregistered(DetectionContext context, List<CanonicalEntity> vendors) {
        List<CanonicalEntity> permits = context.data().taxPermitHolders();
        if (permits.isEmpty()) {
            log.info("crossref.unregistered.skipped reason=no_tax_permit_data");
            return 0;
        }
        double minAmount = context.thresholds().getDouble("ghost_vendor_min_amount", 10000);
        double threshold = context.thresholds().getDouble("name_match_threshold", 0.90);

        List<CanonicalEntity> candidates = new ArrayList<>();
        for (CanonicalEntity vendor : vendors) {
            if (Boolean.FALSE.equals(vendor.booleanAttribute(CanonicalEntity.ATTR_IN_CMBL))
                    && HOME_STATE.equalsIgnoreCase(vendor.stringAttribute(CanonicalEntity.ATTR_STATE))
                    && context.vendorPaymentTotal(vendor.getId()) >= minAmount) {
                candidates.add(vendor);
            }
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        MatchingResult result = context.matchingEngine().match(candidates, permits, context.matchingOptions(threshold));
        Set<Long> permitted = new HashSet<>();
        for (CandidatePair pair : result.pairs()) {
            permitted.add(pair.first().id());
        }

        int alerts = 0;
        for (CanonicalEntity vendor : candidates) {
            if (permitted.contains(vendor.getId())) {
                continue;
            }
            double paid = context.vendorPaymentTotal(vendor.getId());
            String description = String.format(Locale.US,
                    "Vendor '%s' received %s but is not in CMBL and has no matching tax permit",
                    vendor.label(), RuleSupport.wholeMoney(paid));
            alerts += context.raise(new AlertRequest(UNREGISTERED, unregisteredSeverity(paid),
                    "Unregistered vendor: " + RuleSupport.truncate(vendor.label(), 30), description,
                    EntityKind.VENDOR, vendor.getId(),
                    new UnregisteredEvidence(vendor.label(), vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE),
                            vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS),
                            vendor.stringAttribute(CanonicalEntity.ATTR_CITY),
                            vendor.stringAttribute(CanonicalEntity.ATTR_STATE), paid, false, false)));
        }
        return alerts;
    }

    static Map<Long, Double> contractTotals(List<ContractRecord> contracts) {
        Map<Long, Double> totals = new HashMap<>();
        for (ContractRecord contract : contracts) {
            totals.merge(contract.vendorId(), contract.value().doubleValue(), Double::sum);
        }
        return totals;
    }

    static AlertSeverity clusterSeverity(double combined) {
        if (combined > 1_000_000) {
            return AlertSeverity.HIGH;
        }
        return combined > 100_000 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }

    static AlertSeverity roiSeverity(double roi) {
        if (roi > 100) {
            return AlertSeverity.HIGH;
        }
        return roi > 10 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }

    static AlertSeverity unregisteredSeverity(double paid) {
        if (paid > 100_000) {
            return AlertSeverity.HIGH;
        }
        return paid > 25_000 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }

    private static String location(String address, String city, String state) {
        StringBuilder sb = new StringBuilder(address);
        if (city != null) {
            sb.append(", ").append(city);
        }
        if (state != null) {
            sb.append(", ").append(state);
        }
        return sb.toString();
    }
}
