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
 * Checks paid vendors against the exclusion list. A vendor is matched by exact normalized
 * name, otherwise by fuzzy name, and additionally by address for exclusions not already
 * matched by name. Each vendor gets at most one alert, for its strongest match.
 */
public class DebarmentRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(DebarmentRule.class);

    public static final String NAME = "debarment";
    public static final String ALERT_TYPE = "debarred_vendor";

    public static final String ATTR_SOURCE = "source";
    public static final String ATTR_SAM_NUMBER = "sam_number";
    public static final String ATTR_EXCLUSION_TYPE = "exclusion_type";
    public static final String ATTR_EXCLUDING_AGENCY = "excluding_agency";
    public static final String ATTR_REASON = "reason";

    static final double ADDRESS_SCORE = 0.85;

    public enum MatchType {
        EXACT_NAME("exact_name"),
        FUZZY_NAME("fuzzy_name"),
        ADDRESS("address");

        private final String code;

        MatchType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        @Override
        public String toString() {
            return code;
        }
    }

    record Match(CanonicalEntity exclusion, MatchType type, double score) {
    }

    public record VendorDetails(long id, String name, String nameNormalized, String address, String vendorCode) {
    }

    public record ExclusionDetails(long id, String entityName, String source, String samNumber,
                                   String exclusionType, String excludingAgency, String reason) {
    }

    public record PaymentDetails(double totalAmount, long count) {
    }

    public record Evidence(String matchType, double matchScore, VendorDetails vendor, ExclusionDetails exclusion,
                           PaymentDetails payments) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Debarment Check";
    }

    @Override
    public int detect(DetectionContext context) {
        List<CanonicalEntity> exclusions = context.data().debarredEntities();
        if (exclusions.isEmpty()) {
            log.info("debarment.skipped reason=no_active_exclusions");
            return 0;
        }
        double minPayment = context.thresholds().getDouble("debarment_min_payment", 1000);
        double nameThreshold = context.thresholds().getDouble("debarment_name_similarity", 0.90);

        List<CanonicalEntity> vendors = new ArrayList<>();
        for (CanonicalEntity vendor : context.data().vendors()) {
            if (context.vendorPaymentTotal(vendor.getId()) >= minPayment) {
                vendors.add(vendor);
            }
        }
        vendors.sort(Comparator.comparingLong(CanonicalEntity::getId));
        log.info("debarment.start exclusions={} vendors={} minPayment={}", exclusions.size(), vendors.size(), minPayment);

        Map<Long, List<Match>> matches = findMatches(context, vendors, exclusions, nameThreshold);
        Map<Long, CanonicalEntity> vendorIndex = RuleSupport.byId(vendors);

        int alerts = 0;
        for (Map.Entry<Long, List<Match>> entry : matches.entrySet()) {
            CanonicalEntity vendor = vendorIndex.get(entry.getKey());
            for (Match match : entry.getValue()) {
                RelationType type = match.type() == MatchType.ADDRESS
                        ? RelationType.EXCLUSION_ADDRESS
                        : RelationType.EXCLUSION_NAME;
                Map<String, Object> edgeEvidence = new LinkedHashMap<>();
                edgeEvidence.put("match_type", match.type().getCode());
                edgeEvidence.put("score", match.score());
                context.store().upsert(new RelationshipEdge(vendor.ref(), match.exclusion().ref(), type,
                        match.score(), edgeEvidence));
            }
            Match best = entry.getValue().stream()
                    .max(Comparator.comparingDouble(Match::score))
                    .orElseThrow();
            alerts += context.raise(buildAlert(context, vendor, best));
        }
        return alerts;
    }

    Map<Long, List<Match>> findMatches(DetectionContext context, List<CanonicalEntity> vendors,
                                       List<CanonicalEntity> exclusions, double nameThreshold) {
        Map<Long, CanonicalEntity> exclusionIndex = RuleSupport.byId(exclusions);
        Map<Long, List<Match>> exact = new TreeMap<>();
        Map<Long, List<Match>> fuzzy = new TreeMap<>();

        MatchingResult result = context.matchingEngine().match(vendors, exclusions,
                context.matchingOptions(nameThreshold));
        for (CandidatePair pair : result.pairs()) {
            CanonicalEntity exclusion = exclusionIndex.get(pair.second().id());
            if (pair.isExact()) {
                exact.computeIfAbsent(pair.first().id(), k -> new ArrayList<>())
                        .add(new Match(exclusion, MatchType.EXACT_NAME, 1.0));
            } else {
                fuzzy.computeIfAbsent(pair.first().id(), k -> new ArrayList<>())
                        .add(new Match(exclusion, MatchType.FUZZY_NAME, pair.score()));
            }
        }

        Map<String, List<CanonicalEntity>> exclusionsByAddress = new LinkedHashMap<>();
        for (CanonicalEntity exclusion : exclusions) {
            if (exclusion.hasNormalizedAddress()) {
                exclusionsByAddress.computeIfAbsent(exclusion.getNormalizedAddress(), k -> new ArrayList<>())
                        .add(exclusion);
            }
        }

        Map<Long, List<Match>> matches = new TreeMap<>();
        for (CanonicalEntity vendor : vendors) {
            List<Match> found = new ArrayList<>(exact.getOrDefault(vendor.getId(), List.of()));
            if (found.isEmpty()) {
                found.addAll(fuzzy.getOrDefault(vendor.getId(), List.of()));
            }
            if (vendor.hasNormalizedAddress()) {
                for (CanonicalEntity exclusion : exclusionsByAddress.getOrDefault(vendor.getNormalizedAddress(), List.of())) {
                    boolean matchedByName = found.stream().anyMatch(m -> m.exclusion().getId() == exclusion.getId());
                    if (!matchedByName) {
                        found.add(new Match(exclusion, MatchType.ADDRESS, ADDRESS_SCORE));
                    }
                }
            }
            if (!found.isEmpty()) {
                matches.put(vendor.getId(), found);
            }
        }
        return matches;
    }

    static AlertSeverity severityFor(MatchType type, double score) {
        if (type == MatchType.EXACT_NAME || score >= 0.95) {
            return AlertSeverity.HIGH;
        }
        if (score >= 0.90) {
            return AlertSeverity.MEDIUM;
        }
        return AlertSeverity.LOW;
    }

    private AlertRequest buildAlert(DetectionContext context, CanonicalEntity vendor, Match match) {
        CanonicalEntity exclusion = match.exclusion();
        double paid = context.vendorPaymentTotal(vendor.getId());
        String samNumber = exclusion.stringAttribute(ATTR_SAM_NUMBER);
        String source = exclusion.stringAttribute(ATTR_SOURCE);

        Evidence evidence = new Evidence(match.type().getCode(), match.score(),
                new VendorDetails(vendor.getId(), vendor.label(), vendor.getNormalizedName(),
                        vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS),
                        vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE)),
                new ExclusionDetails(exclusion.getId(), exclusion.label(), source, samNumber,
                        exclusion.stringAttribute(ATTR_EXCLUSION_TYPE),
                        exclusion.stringAttribute(ATTR_EXCLUDING_AGENCY),
                        RuleSupport.truncate(exclusion.stringAttribute(ATTR_REASON), 500)),
                new PaymentDetails(paid, context.vendorPaymentCount(vendor.getId())));

        String description = String.format(Locale.US,
                "Vendor '%s' matches %s with excluded entity '%s' (SAM: %s, %s). Total payments: %s",
                vendor.label(), match.type().getCode().replace('_', ' '), exclusion.label(),
                samNumber != null ? samNumber : "N/A", source != null ? source : "unknown source",
                RuleSupport.money(paid));
        return new AlertRequest(ALERT_TYPE, severityFor(match.type(), match.score()),
                "Vendor matches excluded entity: " + RuleSupport.truncate(exclusion.label(), 50),
                description, EntityKind.VENDOR, vendor.getId(), evidence);
    }
}
