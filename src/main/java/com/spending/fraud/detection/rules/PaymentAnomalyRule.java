package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.ContractRecord;
import com.spending.fraud.data.PaymentRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Individual payment patterns: repeated round amounts, a large first payment to a new
 * vendor, payments beyond a contract ceiling, and agencies spending a large share of the
 * fiscal year in August.
 */
public class PaymentAnomalyRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(PaymentAnomalyRule.class);

    public static final String NAME = "anomalies";
    public static final String ROUND_NUMBERS = "round_number_payments";
    public static final String LARGE_FIRST_PAYMENT = "large_first_payment";
    public static final String OVER_CONTRACT = "over_contract_payment";
    public static final String FY_END_SPIKE = "fy_end_spike";

    static final List<BigDecimal> ROUND_AMOUNTS = List.of(
            new BigDecimal("10000"), new BigDecimal("25000"), new BigDecimal("50000"), new BigDecimal("100000"));
    static final int ROUND_MIN_COUNT = 5;
    static final double ROUND_MIN_SHARE = 0.25;
    static final int NEW_VENDOR_DAYS = 730;
    static final int SPIKE_YEARS = 5;
    static final double AUGUST_SHARE_MIN = 0.20;

    public record RoundNumberEvidence(long vendorId, String vendorName, BigDecimal roundAmount, int roundCount,
                                      int totalPayments, double roundPercentage, BigDecimal totalRoundValue)
            implements AlertEvidence {
    }

    public record LargeFirstPaymentEvidence(long vendorId, String vendorName, BigDecimal firstPaymentAmount,
                                            LocalDate firstPaymentDate, LocalDate vendorFirstSeen, Boolean inCmbl,
                                            String agency) implements AlertEvidence {
    }

    public record OverContractEvidence(String contractNumber, BigDecimal contractMaxValue, BigDecimal totalPayments,
                                       BigDecimal excessAmount, double excessPercentage, long vendorId,
                                       String vendorName, String agencyName) implements AlertEvidence {
    }

    public record FiscalYearSpikeEvidence(int fiscalYear, long agencyId, String agencyName, BigDecimal augustSpending,
                                          BigDecimal fyTotalSpending, double augustPercentage)
            implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Payment Anomalies";
    }

    @Override
    public int detect(DetectionContext context) {
        List<PaymentRecord> payments = context.data().allPayments();
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());
        log.info("anomalies.start payments={} vendors={}", payments.size(), vendors.size());

        int alerts = detectRoundNumbers(context, payments, vendors);
        alerts += detectLargeFirstPayments(context, payments, vendors, agencies);
        alerts += detectOverContract(context, payments, vendors, agencies);
        alerts += detectFiscalYearEndSpikes(context, payments, agencies);
        return alerts;
    }

    int detectRoundNumbers(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors) {
        Map<Long, List<PaymentRecord>> byVendor = new TreeMap<>();
        for (PaymentRecord p : payments) {
            byVendor.computeIfAbsent(p.vendorId(), k -> new ArrayList<>()).add(p);
        }

        int alerts = 0;
        for (Map.Entry<Long, List<PaymentRecord>> entry : byVendor.entrySet()) {
            CanonicalEntity vendor = vendors.get(entry.getKey());
            if (vendor == null) {
                continue;
            }
            int total = entry.getValue().size();
            for (BigDecimal amount : ROUND_AMOUNTS) {
                List<PaymentRecord> round = entry.getValue().stream()
                        .filter(p -> p.amount().compareTo(amount) == 0)
                        .toList();
                double share = (double) round.size() / total;
                if (round.size() < ROUND_MIN_COUNT || share < ROUND_MIN_SHARE) {
                    continue;
                }
                BigDecimal value = amount.multiply(BigDecimal.valueOf(round.size()));
                AlertSeverity severity = share >= 0.5 || value.doubleValue() >= 500_000
                        ? AlertSeverity.MEDIUM
                        : AlertSeverity.LOW;
                String description = String.format(Locale.US,
                        "Vendor '%s' has %d payments of exactly %s (%.1f%% of all payments). Total value: %s. "
                                + "Round-number payments may indicate estimation rather than actual invoicing.",
                        vendor.label(), round.size(), RuleSupport.money(amount.doubleValue()), share * 100,
                        RuleSupport.money(value.doubleValue()));
                alerts += context.raise(new AlertRequest(ROUND_NUMBERS, severity,
                        "Unusual round-number payments: " + vendor.label(), description, EntityKind.VENDOR,
                        vendor.getId(), new RoundNumberEvidence(vendor.getId(), vendor.label(), amount, round.size(),
                        total, RuleSupport.round(share * 100, 1), value)));
            }
        }
        return alerts;
    }

    int detectLargeFirstPayments(DetectionContext context, List<PaymentRecord> payments,
                                 Map<Long, CanonicalEntity> vendors, Map<Long, CanonicalEntity> agencies) {
        BigDecimal threshold = context.thresholds().getDecimal("new_vendor_large_payment", new BigDecimal("100000"));
        LocalDate cutoff = context.today().minusDays(NEW_VENDOR_DAYS);

        Map<Long, LocalDate> firstDates = new HashMap<>();
        for (PaymentRecord p : payments) {
            firstDates.merge(p.vendorId(), p.paymentDate(), (a, b) -> a.isBefore(b) ? a : b);
        }
        List<PaymentRecord> firstPayments = payments.stream()
                .filter(p -> p.paymentDate().equals(firstDates.get(p.vendorId())))
                .filter(p -> p.amount().compareTo(threshold) >= 0)
                .sorted(Comparator.comparing(PaymentRecord::amount).reversed().thenComparingLong(PaymentRecord::id))
                .toList();

        int alerts = 0;
        for (PaymentRecord payment : firstPayments) {
            CanonicalEntity vendor = vendors.get(payment.vendorId());
            if (vendor == null) {
                continue;
            }
            LocalDate firstSeen = vendor.dateAttribute(CanonicalEntity.ATTR_FIRST_SEEN);
            if (firstSeen != null && firstSeen.isBefore(cutoff)) {
                continue;
            }
            AlertSeverity severity = payment.amount().doubleValue() >= 500_000 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "New vendor '%s' received %s as their first payment on %s. "
                            + "Large initial payments to new vendors may warrant additional scrutiny.",
                    vendor.label(), RuleSupport.money(payment.amount().doubleValue()), payment.paymentDate());
            alerts += context.raise(new AlertRequest(LARGE_FIRST_PAYMENT, severity,
                    "Large first payment to new vendor: " + vendor.label(), description, EntityKind.VENDOR,
                    vendor.getId(), new LargeFirstPaymentEvidence(vendor.getId(), vendor.label(), payment.amount(),
                    payment.paymentDate(), firstSeen, vendor.booleanAttribute(CanonicalEntity.ATTR_IN_CMBL),
                    RuleSupport.nameOf(agencies, payment.agencyId(), null))));
        }
        return alerts;
    }

    int detectOverContract(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors,
                           Map<Long, CanonicalEntity> agencies) {
        Map<String, BigDecimal> paidByPair = new HashMap<>();
        for (PaymentRecord p : payments) {
            paidByPair.merge(p.vendorId() + ":" + p.agencyId(), p.amount(), BigDecimal::add);
        }

        int alerts = 0;
        for (ContractRecord contract : context.data().contracts()) {
            if (!contract.hasMaxValue()) {
                continue;
            }
            BigDecimal paid = paidByPair.getOrDefault(contract.vendorId() + ":" + contract.agencyId(), BigDecimal.ZERO);
            if (paid.compareTo(contract.maxValue()) <= 0) {
                continue;
            }
            BigDecimal excess = paid.subtract(contract.maxValue());
            double excessPct = excess.doubleValue() / contract.maxValue().doubleValue() * 100;
            AlertSeverity severity = excessPct >= 50 || excess.doubleValue() >= 100_000
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String vendorName = RuleSupport.nameOf(vendors, contract.vendorId(), "Unknown");
            String description = String.format(Locale.US,
                    "Contract %s has max value %s but total payments are %s (%s / %.1f%% over). Vendor: %s.",
                    contract.contractNumber(), RuleSupport.money(contract.maxValue().doubleValue()),
                    RuleSupport.money(paid.doubleValue()), RuleSupport.money(excess.doubleValue()), excessPct,
                    vendorName);
            alerts += context.raise(new AlertRequest(OVER_CONTRACT, severity,
                    "Payments exceed contract: " + contract.contractNumber(), description, EntityKind.CONTRACT,
                    contract.id(), new OverContractEvidence(contract.contractNumber(), contract.maxValue(), paid,
                    excess, RuleSupport.round(excessPct, 1), contract.vendorId(), vendorName,
                    RuleSupport.nameOf(agencies, contract.agencyId(), null))));
        }
        return alerts;
    }

    /**
     * Checks the last completed fiscal years, most recent first, so an agency's alert
     * describes its latest spike.
     */
    int detectFiscalYearEndSpikes(DetectionContext context, List<PaymentRecord> payments,
                                  Map<Long, CanonicalEntity> agencies) {
        int currentYear = StateFiscalYear.of(context.today());
        int alerts = 0;
        for (int fy = currentYear - 1; fy >= currentYear - SPIKE_YEARS; fy--) {
            LocalDate start = StateFiscalYear.start(fy);
            LocalDate end = StateFiscalYear.end(fy);
            LocalDate august = StateFiscalYear.augustStart(fy);

            Map<Long, BigDecimal[]> totals = new TreeMap<>();
            for (PaymentRecord p : payments) {
                if (p.paymentDate().isBefore(start) || p.paymentDate().isAfter(end)) {
                    continue;
                }
                BigDecimal[] t = totals.computeIfAbsent(p.agencyId(), k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
                t[1] = t[1].add(p.amount());
                if (!p.paymentDate().isBefore(august)) {
                    t[0] = t[0].add(p.amount());
                }
            }

            for (Map.Entry<Long, BigDecimal[]> entry : totals.entrySet()) {
                CanonicalEntity agency = agencies.get(entry.getKey());
                BigDecimal augustTotal = entry.getValue()[0];
                BigDecimal yearTotal = entry.getValue()[1];
                if (agency == null || yearTotal.signum() <= 0) {
                    continue;
                }
                double share = augustTotal.doubleValue() / yearTotal.doubleValue();
                if (share < AUGUST_SHARE_MIN) {
                    continue;
                }
                String description = String.format(Locale.US,
                        "%s spent %s in August %d (%.1f%% of FY total). "
                                + "High year-end spending may indicate 'use it or lose it' behavior.",
                        agency.label(), RuleSupport.money(augustTotal.doubleValue()), fy, share * 100);
                alerts += context.raise(new AlertRequest(FY_END_SPIKE,
                        share >= 0.35 ? AlertSeverity.MEDIUM : AlertSeverity.LOW,
                        "FY" + fy + " year-end spending spike: " + agency.label(), description, EntityKind.AGENCY,
                        agency.getId(), new FiscalYearSpikeEvidence(fy, agency.getId(), agency.label(), augustTotal,
                        yearTotal, RuleSupport.round(share * 100, 1))));
            }
        }
        return alerts;
    }
}
