package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.PaymentRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Year-end spending patterns over completed Texas fiscal years: agencies whose July and
 * August spending spikes against the first ten months, vendors paid mostly in the final
 * two months, and agencies making large payments in the last five days of the year.
 */
public class FiscalYearRushRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(FiscalYearRushRule.class);

    public static final String NAME = "fiscal_year_rush";

    static final int AGENCY_YEARS = 5;
    static final int VENDOR_YEARS = 3;
    static final double VENDOR_MIN_TOTAL = 50_000;
    static final double VENDOR_MIN_SHARE = 70.0;

    /**
     * Running totals for one agency or vendor within one fiscal year.
     */
    static final class YearTotals {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal finalMonths = BigDecimal.ZERO;
        BigDecimal july = BigDecimal.ZERO;
        BigDecimal august = BigDecimal.ZERO;
        int count;
        int finalMonthsCount;

        void add(PaymentRecord payment, int fiscalYear) {
            total = total.add(payment.amount());
            count++;
            LocalDate date = payment.paymentDate();
            if (!date.isBefore(StateFiscalYear.finalMonthsStart(fiscalYear))) {
                finalMonths = finalMonths.add(payment.amount());
                finalMonthsCount++;
                if (date.isBefore(StateFiscalYear.augustStart(fiscalYear))) {
                    july = july.add(payment.amount());
                } else {
                    august = august.add(payment.amount());
                }
            }
        }
    }

    public record SpikeEvidence(int fiscalYear, long agencyId, String agencyName, double fyTotalSpending,
                                double finalMonthsSpending, double finalMonthsPercentage, double monthlyAverage,
                                double finalMonthsRatio, double julySpending, double augustSpending,
                                double augustRatio, int paymentCount) implements AlertEvidence {
    }

    public record ConcentrationEvidence(int fiscalYear, long vendorId, String vendorName, double fyTotal,
                                        double finalMonthsTotal, double finalMonthsPercentage, int paymentCount,
                                        int finalMonthsPaymentCount) implements AlertEvidence {
    }

    public record VendorAmount(long vendorId, String vendorName, double amount) {
    }

    public record ClusterEvidence(int fiscalYear, long agencyId, String agencyName, double finalDaysTotal,
                                  int paymentCount, int vendorCount, String dateRange,
                                  List<VendorAmount> topVendors) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Fiscal Year Rush";
    }

    @Override
    public int detect(DetectionContext context) {
        double multiplier = context.thresholds().getDouble("fy_end_spike_multiplier", 2.0);
        double minAmount = context.thresholds().getDouble("fy_end_min_amount", 100_000);
        int currentYear = StateFiscalYear.of(context.today());
        int firstYear = currentYear - AGENCY_YEARS;

        List<PaymentRecord> payments = context.data().payments(
                StateFiscalYear.start(firstYear), StateFiscalYear.end(currentYear - 1));
        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        log.info("fiscal_year_rush.start payments={} years={}..{} multiplier={}",
                payments.size(), firstYear, currentYear - 1, multiplier);

        int alerts = 0;
        for (int fy = firstYear; fy < currentYear; fy++) {
            alerts += detectAgencySpikes(context, fy, payments, agencies, multiplier, minAmount);
        }
        for (int fy = currentYear - VENDOR_YEARS; fy < currentYear; fy++) {
            alerts += detectVendorConcentration(context, fy, payments, vendors);
        }
        for (int fy = firstYear; fy < currentYear; fy++) {
            alerts += detectFinalDayClusters(context, fy, payments, agencies, vendors, minAmount);
        }
        return alerts;
    }

    int detectAgencySpikes(DetectionContext context, int fy, List<PaymentRecord> payments,
                           Map<Long, CanonicalEntity> agencies, double multiplier, double minAmount) {
        Map<Long, YearTotals> byAgency = new TreeMap<>();
        for (PaymentRecord p : payments) {
            if (StateFiscalYear.of(p.paymentDate()) == fy) {
                byAgency.computeIfAbsent(p.agencyId(), k -> new YearTotals()).add(p, fy);
            }
        }

        int alerts = 0;
        for (Map.Entry<Long, YearTotals> entry : byAgency.entrySet()) {
            YearTotals t = entry.getValue();
            double fyTotal = t.total.doubleValue();
            double finalTotal = t.finalMonths.doubleValue();
            double firstTen = fyTotal - finalTotal;
            if (firstTen <= 0) {
                continue;
            }
            double monthlyAverage = firstTen / 10.0;
            double finalRatio = finalTotal / monthlyAverage;
            double augustRatio = t.august.doubleValue() / monthlyAverage;
            if ((finalRatio < multiplier && augustRatio < multiplier) || finalTotal < minAmount) {
                continue;
            }
            CanonicalEntity agency = agencies.get(entry.getKey());
            if (agency == null) {
                continue;
            }
            double finalPct = fyTotal > 0 ? finalTotal / fyTotal * 100.0 : 0.0;
            AlertSeverity severity = spikeSeverity(augustRatio, finalPct, multiplier);
            String description = String.format(Locale.US,
                    "%s spent %s in the final two months of FY%d (%.1f%% of annual total). "
                            + "This is %.1fx the monthly average of %s. August alone: %s (%.1fx average). "
                            + "This pattern may indicate 'use it or lose it' budget rushing.",
                    agency.label(), RuleSupport.money(finalTotal), fy, finalPct, finalRatio,
                    RuleSupport.money(monthlyAverage), RuleSupport.money(t.august.doubleValue()), augustRatio);
            alerts += context.raise(new AlertRequest("fiscal_year_spending_rush", severity,
                    "FY" + fy + " year-end spending spike: " + agency.label(), description,
                    EntityKind.AGENCY, agency.getId(),
                    new SpikeEvidence(fy, agency.getId(), agency.label(), fyTotal, finalTotal,
                            RuleSupport.round(finalPct, 1), monthlyAverage, RuleSupport.round(finalRatio, 2),
                            t.july.doubleValue(), t.august.doubleValue(), RuleSupport.round(augustRatio, 2),
                            t.count)));
        }
        return alerts;
    }

    static AlertSeverity spikeSeverity(double augustRatio, double finalMonthsPercentage, double multiplier) {
        if (augustRatio >= multiplier * 1.5 || finalMonthsPercentage >= 35.0) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.MEDIUM;
    }

    int detectVendorConcentration(DetectionContext context, int fy, List<PaymentRecord> payments,
                                  Map<Long, CanonicalEntity> vendors) {
        Map<Long, YearTotals> byVendor = new TreeMap<>();
        for (PaymentRecord p : payments) {
            if (StateFiscalYear.of(p.paymentDate()) == fy) {
                byVendor.computeIfAbsent(p.vendorId(), k -> new YearTotals()).add(p, fy);
            }
        }

        int alerts = 0;
        for (Map.Entry<Long, YearTotals> entry : byVendor.entrySet()) {
            YearTotals t = entry.getValue();
            double fyTotal = t.total.doubleValue();
            if (fyTotal < VENDOR_MIN_TOTAL) {
                continue;
            }
            double pct = t.finalMonths.doubleValue() / fyTotal * 100.0;
            if (pct < VENDOR_MIN_SHARE) {
                continue;
            }
            CanonicalEntity vendor = vendors.get(entry.getKey());
            if (vendor == null) {
                continue;
            }
            AlertSeverity severity = pct >= 90.0 || fyTotal >= 500_000 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "Vendor '%s' received %.0f%% (%s of %s) of their FY%d payments in the final two months. "
                            + "This unusual concentration may indicate coordination with agencies to spend "
                            + "remaining budget allocations.",
                    vendor.label(), pct, RuleSupport.money(t.finalMonths.doubleValue()),
                    RuleSupport.money(fyTotal), fy);
            alerts += context.raise(new AlertRequest("vendor_fy_end_concentration", severity,
                    "Vendor with FY" + fy + " year-end payment concentration: " + vendor.label(), description,
                    EntityKind.VENDOR, vendor.getId(),
                    new ConcentrationEvidence(fy, vendor.getId(), vendor.label(), fyTotal,
                            t.finalMonths.doubleValue(), RuleSupport.round(pct, 1), t.count, t.finalMonthsCount)));
        }
        return alerts;
    }

    int detectFinalDayClusters(DetectionContext context, int fy, List<PaymentRecord> payments,
                               Map<Long, CanonicalEntity> agencies, Map<Long, CanonicalEntity> vendors,
                               double minAmount) {
        LocalDate from = StateFiscalYear.finalDaysStart(fy);
        LocalDate to = StateFiscalYear.end(fy);
        Map<Long, List<PaymentRecord>> byAgency = new TreeMap<>();
        for (PaymentRecord p : payments) {
            if (!p.paymentDate().isBefore(from) && !p.paymentDate().isAfter(to)) {
                byAgency.computeIfAbsent(p.agencyId(), k -> new ArrayList<>()).add(p);
            }
        }

        int alerts = 0;
        for (Map.Entry<Long, List<PaymentRecord>> entry : byAgency.entrySet()) {
            List<PaymentRecord> cluster = entry.getValue();
            BigDecimal total = BigDecimal.ZERO;
            Map<Long, BigDecimal> perVendor = new TreeMap<>();
            Set<Long> vendorIds = new HashSet<>();
            for (PaymentRecord p : cluster) {
                total = total.add(p.amount());
                perVendor.merge(p.vendorId(), p.amount(), BigDecimal::add);
                vendorIds.add(p.vendorId());
            }
            if (total.doubleValue() < minAmount) {
                continue;
            }
            CanonicalEntity agency = agencies.get(entry.getKey());
            if (agency == null) {
                continue;
            }
            List<VendorAmount> top = perVendor.entrySet().stream()
                    .map(e -> new VendorAmount(e.getKey(), RuleSupport.nameOf(vendors, e.getKey(), null),
                            e.getValue().doubleValue()))
                    .sorted(Comparator.comparingDouble(VendorAmount::amount).reversed()
                            .thenComparingLong(VendorAmount::vendorId))
                    .limit(10)
                    .toList();

            AlertSeverity severity = total.doubleValue() >= 1_000_000 || cluster.size() >= 50
                    ? AlertSeverity.HIGH
                    : AlertSeverity.MEDIUM;
            String description = String.format(Locale.US,
                    "%s made %d payments totaling %s to %d vendors in the final 5 days of FY%d (Aug 27-31). "
                            + "This last-minute spending rush may indicate poor planning or intentional budget "
                            + "exhaustion.",
                    agency.label(), cluster.size(), RuleSupport.money(total.doubleValue()), vendorIds.size(), fy);
            alerts += context.raise(new AlertRequest("fy_end_payment_cluster", severity,
                    "FY" + fy + " last-minute payment cluster: " + agency.label(), description,
                    EntityKind.AGENCY, agency.getId(),
                    new ClusterEvidence(fy, agency.getId(), agency.label(), total.doubleValue(), cluster.size(),
                            vendorIds.size(), from + " to " + to, top)));
        }
        return alerts;
    }
}
