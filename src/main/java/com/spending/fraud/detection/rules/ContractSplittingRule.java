package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.config.DetectionThresholds;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.ContractRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flags vendor/agency pairs with several contracts clustered just below a procurement
 * threshold: the LBB reporting threshold (default $45K-$50K) and the ESBD posting
 * threshold ($22K-$25K). Uniform values (coefficient of variation below 0.1) across five
 * or more contracts escalate the alert to HIGH.
 */
public class ContractSplittingRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(ContractSplittingRule.class);

    public static final String NAME = "contract_splitting";
    public static final String ALERT_TYPE = "contract_splitting";

    static final double UNIFORM_CV = 0.1;
    static final int UNIFORM_MIN_COUNT = 5;
    private static final BigDecimal ESBD_MIN = new BigDecimal("22000");

    record ThresholdRange(String name, BigDecimal min, BigDecimal max, AlertSeverity baseSeverity) {
    }

    public record ContractLine(String number, BigDecimal value, LocalDate startDate, String description) {
    }

    public record Evidence(
            long vendorId,
            String vendorName,
            Long agencyId,
            String agencyName,
            int contractCount,
            BigDecimal totalValue,
            BigDecimal averageValue,
            String thresholdName,
            List<ContractLine> contracts,
            Double coefficientOfVariation
    ) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Contract Splitting";
    }

    @Override
    public int detect(DetectionContext context) {
        DetectionThresholds t = context.thresholds();
        int count = t.getInt("contract_splitting_count", 3);
        int months = t.getInt("contract_splitting_months", 12);
        LocalDate cutoff = context.today().minusDays(months * 30L);

        List<ThresholdRange> ranges = List.of(
                new ThresholdRange("LBB reporting threshold ($50K)",
                        t.getDecimal("contract_splitting_min", new BigDecimal("45000")),
                        t.getDecimal("contract_splitting_max", new BigDecimal("50000")),
                        AlertSeverity.MEDIUM),
                new ThresholdRange("ESBD posting threshold ($25K)",
                        ESBD_MIN,
                        t.getDecimal("esbd_threshold", new BigDecimal("25000")),
                        AlertSeverity.LOW));

        List<ContractRecord> contracts = context.data().contracts();
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());

        int alerts = 0;
        for (ThresholdRange range : ranges) {
            alerts += checkRange(context, range, contracts, cutoff, count, months, vendors, agencies);
        }
        return alerts;
    }

    private int checkRange(DetectionContext context, ThresholdRange range, List<ContractRecord> contracts,
                           LocalDate cutoff, int countThreshold, int months,
                           Map<Long, CanonicalEntity> vendors, Map<Long, CanonicalEntity> agencies) {
        Map<String, List<ContractRecord>> groups = new TreeMap<>();
        for (ContractRecord c : contracts) {
            if (c.startDate() == null || c.startDate().isBefore(cutoff)) {
                continue;
            }
            if (c.value().compareTo(range.min()) < 0 || c.value().compareTo(range.max()) > 0) {
                continue;
            }
            groups.computeIfAbsent(c.vendorId() + ":" + c.agencyId(), k -> new ArrayList<>()).add(c);
        }

        int alerts = 0;
        for (List<ContractRecord> group : groups.values()) {
            if (group.size() < countThreshold) {
                continue;
            }
            group.sort(Comparator.comparing(ContractRecord::startDate).thenComparingLong(ContractRecord::id));
            ContractRecord first = group.get(0);
            CanonicalEntity vendor = vendors.get(first.vendorId());
            if (vendor == null) {
                log.debug("contract_splitting.unknown_vendor id={}", first.vendorId());
                continue;
            }
            CanonicalEntity agency = agencies.get(first.agencyId());
            alerts += context.raise(buildAlert(range, group, vendor, agency, months));
        }
        return alerts;
    }

    AlertRequest buildAlert(ThresholdRange range, List<ContractRecord> group, CanonicalEntity vendor,
                            CanonicalEntity agency, int months) {
        BigDecimal total = BigDecimal.ZERO;
        List<Double> values = new ArrayList<>(group.size());
        List<ContractLine> lines = new ArrayList<>(group.size());
        for (ContractRecord c : group) {
            total = total.add(c.value());
            values.add(c.value().doubleValue());
            lines.add(new ContractLine(c.contractNumber(), c.value(), c.startDate(),
                    RuleSupport.truncate(c.description(), 100)));
        }
        BigDecimal average = total.divide(BigDecimal.valueOf(group.size()), 2, RoundingMode.HALF_UP);

        AlertSeverity severity = range.baseSeverity();
        Double cv = null;
        if (values.size() > 1) {
            double mean = RuleSupport.mean(values);
            double raw = mean > 0 ? RuleSupport.populationStddev(values, mean) / mean : 1.0;
            cv = RuleSupport.round(raw, 3);
            severity = severityFor(range.baseSeverity(), raw, group.size());
        }

        String agencyName = agency != null ? agency.label() : "Unknown";
        Evidence evidence = new Evidence(vendor.getId(), vendor.label(),
                agency != null ? agency.getId() : null, agencyName, group.size(), total, average,
                range.name(), lines, cv);

        String description = String.format(Locale.US,
                "Vendor '%s' has %d contracts in the %s-%s range%s within the past %d months. "
                        + "Total value: %s. This pattern may indicate intentional splitting to avoid the %s.",
                vendor.label(), group.size(), RuleSupport.wholeMoney(range.min().doubleValue()),
                RuleSupport.wholeMoney(range.max().doubleValue()),
                agency != null ? " with " + agency.label() : "", months,
                RuleSupport.money(total.doubleValue()), range.name());

        return new AlertRequest(ALERT_TYPE, severity, "Potential contract splitting: " + vendor.label(),
                description, EntityKind.VENDOR, vendor.getId(), evidence);
    }

    /**
     * Escalates to HIGH when the values are uniform and numerous; otherwise keeps the base.
     */
    static AlertSeverity severityFor(AlertSeverity base, double coefficientOfVariation, int count) {
        if (coefficientOfVariation < UNIFORM_CV && count >= UNIFORM_MIN_COUNT) {
            return AlertSeverity.HIGH;
        }
        return base;
    }
}
