package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.data.PaymentRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Payments that may have been made twice: identical payments to a vendor on the same day,
 * payments of the same amount to a vendor within the window, and payments of the same
 * amount to two vendors the relationship store links by a shared address.
 */
public class DuplicatePaymentRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(DuplicatePaymentRule.class);

    public static final String NAME = "duplicates";
    public static final String EXACT = "duplicate_payment";
    public static final String NEAR = "near_duplicate_payment";
    public static final String RELATED_VENDOR = "related_vendor_duplicate";

    static final BigDecimal EXACT_MIN_AMOUNT = new BigDecimal("100");
    static final BigDecimal NEAR_MIN_AMOUNT = new BigDecimal("5000");
    static final BigDecimal RELATED_MIN_AMOUNT = new BigDecimal("1000");

    /**
     * Vendor and amount, with the amount compared by value so that 500.0 and 500.00 agree.
     */
    record AmountKey(long vendorId, BigDecimal amount) implements Comparable<AmountKey> {
        AmountKey {
            amount = amount.stripTrailingZeros();
        }

        @Override
        public int compareTo(AmountKey other) {
            int byVendor = Long.compare(vendorId, other.vendorId);
            return byVendor != 0 ? byVendor : amount.compareTo(other.amount);
        }
    }

    public record PaymentLine(long id, LocalDate date, String agency, String description) {
    }

    public record ExactEvidence(long vendorId, String vendorName, BigDecimal amount, LocalDate paymentDate,
                                int duplicateCount, BigDecimal totalDuplicateAmount, List<String> agencies,
                                List<PaymentLine> payments) implements AlertEvidence {
    }

    public record NearEvidence(long vendorId, String vendorName, BigDecimal amount, int paymentCount,
                               String dateRange, List<PaymentLine> payments) implements AlertEvidence {
    }

    public record RelatedVendorEvidence(long vendor1Id, String vendor1Name, long vendor2Id, String vendor2Name,
                                        BigDecimal amount, LocalDate payment1Date, LocalDate payment2Date,
                                        String sharedAddress) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Duplicate Payments";
    }

    @Override
    public int detect(DetectionContext context) {
        int windowDays = context.thresholds().getInt("duplicate_payment_window_days", 30);
        List<PaymentRecord> payments = context.data().allPayments();
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());
        log.info("duplicates.start payments={} windowDays={}", payments.size(), windowDays);

        int alerts = detectExact(context, payments, vendors, agencies);
        alerts += detectNear(context, payments, vendors, agencies, windowDays);
        alerts += detectRelatedVendors(context, payments, vendors, windowDays);
        return alerts;
    }

    int detectExact(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors,
                    Map<Long, CanonicalEntity> agencies) {
        Map<AmountKey, Map<LocalDate, List<PaymentRecord>>> groups = new TreeMap<>();
        for (PaymentRecord p : payments) {
            if (p.amount().compareTo(EXACT_MIN_AMOUNT) > 0) {
                groups.computeIfAbsent(new AmountKey(p.vendorId(), p.amount()), k -> new TreeMap<>())
                        .computeIfAbsent(p.paymentDate(), k -> new ArrayList<>())
                        .add(p);
            }
        }

        int alerts = 0;
        for (Map.Entry<AmountKey, Map<LocalDate, List<PaymentRecord>>> group : groups.entrySet()) {
            CanonicalEntity vendor = vendors.get(group.getKey().vendorId());
            if (vendor == null) {
                continue;
            }
            BigDecimal amount = group.getKey().amount();
            for (Map.Entry<LocalDate, List<PaymentRecord>> sameDay : group.getValue().entrySet()) {
                List<PaymentRecord> dups = sameDay.getValue();
                if (dups.size() < 2) {
                    continue;
                }
                BigDecimal total = amount.multiply(BigDecimal.valueOf(dups.size()));
                Set<String> agencyNames = new TreeSet<>();
                dups.forEach(p -> agencyNames.add(RuleSupport.nameOf(agencies, p.agencyId(), "Unknown")));
                String description = String.format(Locale.US,
                        "Found %d identical payments of %s to '%s' on %s. Total duplicate amount: %s.",
                        dups.size(), RuleSupport.money(amount.doubleValue()), vendor.label(), sameDay.getKey(),
                        RuleSupport.money(total.doubleValue()));
                alerts += context.raise(new AlertRequest(EXACT, exactSeverity(dups.size(), amount.doubleValue()),
                        "Exact duplicate payments: " + vendor.label(), description, EntityKind.VENDOR, vendor.getId(),
                        new ExactEvidence(vendor.getId(), vendor.label(), amount, sameDay.getKey(), dups.size(),
                                total, List.copyOf(agencyNames), lines(dups, agencies))));
            }
        }
        return alerts;
    }

    int detectNear(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors,
                   Map<Long, CanonicalEntity> agencies, int windowDays) {
        Map<AmountKey, List<PaymentRecord>> groups = new TreeMap<>();
        for (PaymentRecord p : payments) {
            if (p.amount().compareTo(NEAR_MIN_AMOUNT) >= 0) {
                groups.computeIfAbsent(new AmountKey(p.vendorId(), p.amount()), k -> new ArrayList<>()).add(p);
            }
        }

        int alerts = 0;
        for (Map.Entry<AmountKey, List<PaymentRecord>> group : groups.entrySet()) {
            CanonicalEntity vendor = vendors.get(group.getKey().vendorId());
            if (vendor == null || group.getValue().size() < 2) {
                continue;
            }
            BigDecimal amount = group.getKey().amount();
            for (List<PaymentRecord> cluster : clusters(group.getValue(), windowDays)) {
                LocalDate from = cluster.get(0).paymentDate();
                LocalDate to = cluster.get(cluster.size() - 1).paymentDate();
                // same-day clusters are exact duplicates
                if (from.equals(to)) {
                    continue;
                }
                String description = String.format(Locale.US,
                        "Found %d payments of %s to '%s' within %d days (%s to %s). Total: %s.",
                        cluster.size(), RuleSupport.money(amount.doubleValue()), vendor.label(), windowDays, from, to,
                        RuleSupport.money(amount.doubleValue() * cluster.size()));
                alerts += context.raise(new AlertRequest(NEAR, nearSeverity(cluster.size(), amount.doubleValue()),
                        "Potential duplicate payments: " + vendor.label(), description, EntityKind.VENDOR,
                        vendor.getId(), new NearEvidence(vendor.getId(), vendor.label(), amount, cluster.size(),
                        from + " to " + to, lines(cluster, agencies))));
            }
        }
        return alerts;
    }

    /**
     * Splits payments into runs where consecutive payments are at most {@code windowDays}
     * apart. Runs of a single payment are dropped.
     */
    static List<List<PaymentRecord>> clusters(List<PaymentRecord> payments, int windowDays) {
        List<PaymentRecord> sorted = new ArrayList<>(payments);
        sorted.sort(Comparator.comparing(PaymentRecord::paymentDate).thenComparingLong(PaymentRecord::id));
        List<List<PaymentRecord>> clusters = new ArrayList<>();
        List<PaymentRecord> current = new ArrayList<>();
        for (PaymentRecord p : sorted) {
            if (!current.isEmpty()
                    && ChronoUnit.DAYS.between(current.get(current.size() - 1).paymentDate(), p.paymentDate()) > windowDays) {
                if (current.size() > 1) {
                    clusters.add(current);
                }
                current = new ArrayList<>();
            }
            current.add(p);
        }
        if (current.size() > 1) {
            clusters.add(current);
        }
        return clusters;
    }

    int detectRelatedVendors(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors,
                             int windowDays) {
        List<RelationshipEdge> links = context.store().queryPairs(RelationType.SAME_ADDRESS).stream()
                .filter(e -> e.entityKind1() == EntityKind.VENDOR && e.entityKind2() == EntityKind.VENDOR)
                .toList();
        if (links.isEmpty()) {
            return 0;
        }
        Map<Long, List<PaymentRecord>> byVendor = new HashMap<>();
        for (PaymentRecord p : payments) {
            if (p.amount().compareTo(RELATED_MIN_AMOUNT) >= 0) {
                byVendor.computeIfAbsent(p.vendorId(), k -> new ArrayList<>()).add(p);
            }
        }

        int alerts = 0;
        for (RelationshipEdge link : links) {
            CanonicalEntity vendor1 = vendors.get(link.entityId1());
            CanonicalEntity vendor2 = vendors.get(link.entityId2());
            if (vendor1 == null || vendor2 == null) {
                continue;
            }
            PaymentRecord[] pair = firstSharedAmount(byVendor.getOrDefault(vendor1.getId(), List.of()),
                    byVendor.getOrDefault(vendor2.getId(), List.of()), windowDays);
            if (pair == null) {
                continue;
            }
            String address = vendor1.stringAttribute(CanonicalEntity.ATTR_ADDRESS);
            String description = String.format(Locale.US,
                    "Found %s payment to both '%s' and '%s' (same address: %s). "
                            + "This may indicate duplicate payments or fraudulent vendors.",
                    RuleSupport.money(pair[1].amount().doubleValue()), vendor1.label(), vendor2.label(), address);
            alerts += context.raise(new AlertRequest(RELATED_VENDOR, AlertSeverity.MEDIUM,
                    "Same payment to related vendors", description, EntityKind.VENDOR, vendor1.getId(),
                    new RelatedVendorEvidence(vendor1.getId(), vendor1.label(), vendor2.getId(), vendor2.label(),
                            pair[1].amount(), pair[0].paymentDate(), pair[1].paymentDate(), address)));
        }
        return alerts;
    }

    /**
     * The earliest payment of the second vendor that has a payment of equal amount to the
     * first vendor within the window, paired with the closest such payment.
     */
    static PaymentRecord[] firstSharedAmount(List<PaymentRecord> first, List<PaymentRecord> second, int windowDays) {
        List<PaymentRecord> ordered = new ArrayList<>(second);
        ordered.sort(Comparator.comparing(PaymentRecord::paymentDate).thenComparingLong(PaymentRecord::id));
        for (PaymentRecord p2 : ordered) {
            PaymentRecord best = null;
            long bestGap = Long.MAX_VALUE;
            for (PaymentRecord p1 : first) {
                if (p1.amount().compareTo(p2.amount()) != 0) {
                    continue;
                }
                long gap = Math.abs(ChronoUnit.DAYS.between(p1.paymentDate(), p2.paymentDate()));
                if (gap <= windowDays && (gap < bestGap || (gap == bestGap && p1.id() < best.id()))) {
                    best = p1;
                    bestGap = gap;
                }
            }
            if (best != null) {
                return new PaymentRecord[]{best, p2};
            }
        }
        return null;
    }

    static AlertSeverity exactSeverity(int count, double amount) {
        if (count >= 5 || amount >= 50_000) {
            return AlertSeverity.HIGH;
        }
        if (count >= 3 || amount >= 10_000) {
            return AlertSeverity.MEDIUM;
        }
        return AlertSeverity.LOW;
    }

    static AlertSeverity nearSeverity(int count, double amount) {
        if (count >= 6 || amount >= 25_000) {
            return AlertSeverity.HIGH;
        }
        return count >= 4 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }

    private static List<PaymentLine> lines(List<PaymentRecord> payments, Map<Long, CanonicalEntity> agencies) {
        return payments.stream()
                .map(p -> new PaymentLine(p.id(), p.paymentDate(), RuleSupport.nameOf(agencies, p.agencyId(), null),
                        RuleSupport.truncate(p.description(), 100)))
                .toList();
    }
}
