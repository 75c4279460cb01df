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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Use of the confidential flag on payments: agencies that withhold an unusual share of
 * their payments, agencies whose rate jumped in the last quarter, and vendors paid mostly
 * through confidential payments.
 */
public class ConfidentialityRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(ConfidentialityRule.class);

    public static final String NAME = "confidentiality";
    public static final String HIGH_RATE = "high_confidentiality_rate";
    public static final String SPIKE = "confidentiality_spike";
    public static final String VENDOR_HIGH_RATE = "vendor_high_confidentiality";

    static final int AGENCY_MIN_PAYMENTS = 100;
    static final int RECENT_DAYS = 90;
    static final int HISTORY_DAYS = 365;
    static final int RECENT_MIN_PAYMENTS = 50;
    static final int HISTORY_MIN_PAYMENTS = 100;
    static final double SPIKE_MIN_INCREASE = 0.10;
    static final int VENDOR_MIN_PAYMENTS = 10;
    static final double VENDOR_MIN_RATE = 0.5;

    public record AgencyRateEvidence(long agencyId, String agencyName, int totalTransactions,
                                     int confidentialTransactions, double confidentialityRate, double totalAmount,
                                     double confidentialAmount, double confidentialAmountRate)
            implements AlertEvidence {
    }

    public record SpikeEvidence(long agencyId, String agencyName, double recentRate, double historicalRate,
                                double increase, int recentTransactions, int recentConfidential)
            implements AlertEvidence {
    }

    public record VendorRateEvidence(long vendorId, String vendorName, int totalPayments, int confidentialPayments,
                                     double confidentialRate, double totalAmount) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Confidentiality Analysis";
    }

    @Override
    public int detect(DetectionContext context) {
        double rateThreshold = context.thresholds().getDouble("confidentiality_rate_threshold", 0.20);
        List<PaymentRecord> payments = context.data().allPayments();
        log.info("confidentiality.start payments={} rateThreshold={}", payments.size(), rateThreshold);

        Map<Long, CanonicalEntity> agencies = RuleSupport.byId(context.data().agencies());
        int alerts = detectHighRates(context, payments, agencies, rateThreshold);
        alerts += detectSpikes(context, payments, agencies);
        alerts += detectVendorRates(context, payments, RuleSupport.byId(context.data().vendors()));
        return alerts;
    }

    int detectHighRates(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> agencies,
                        double rateThreshold) {
        int alerts = 0;
        for (Map.Entry<Long, PaymentSummary> entry : PaymentSummary.byAgency(payments).entrySet()) {
            CanonicalEntity agency = agencies.get(entry.getKey());
            PaymentSummary summary = entry.getValue();
            if (agency == null || summary.count < AGENCY_MIN_PAYMENTS) {
                continue;
            }
            double rate = summary.confidentialRate();
            if (rate < rateThreshold) {
                continue;
            }
            double total = summary.totalAmount();
            double confidential = summary.confidentialTotal.doubleValue();
            double amountRate = total > 0 ? confidential / total : 0.0;
            String description = String.format(Locale.US,
                    "%s has %.1f%% of transactions marked confidential (%,d of %,d). "
                            + "Confidential amount: %s (%.1f%% of total). This exceeds the %s threshold.",
                    agency.label(), rate * 100, summary.confidentialCount, summary.count,
                    RuleSupport.money(confidential), amountRate * 100, RuleSupport.percent(rateThreshold));
            alerts += context.raise(new AlertRequest(HIGH_RATE, rate >= 0.40 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                    "High confidentiality rate: " + agency.label(), description, EntityKind.AGENCY, agency.getId(),
                    new AgencyRateEvidence(agency.getId(), agency.label(), summary.count, summary.confidentialCount,
                            RuleSupport.round(rate * 100, 1), total, confidential,
                            RuleSupport.round(amountRate * 100, 1))));
        }
        return alerts;
    }

    /**
     * Compares the last 90 days with the 275 days before them.
     */
    int detectSpikes(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> agencies) {
        LocalDate recentStart = context.today().minusDays(RECENT_DAYS);
        LocalDate historyStart = context.today().minusDays(HISTORY_DAYS);
        List<PaymentRecord> recent = new ArrayList<>();
        List<PaymentRecord> history = new ArrayList<>();
        for (PaymentRecord p : payments) {
            if (!p.paymentDate().isBefore(recentStart)) {
                recent.add(p);
            } else if (!p.paymentDate().isBefore(historyStart)) {
                history.add(p);
            }
        }
        Map<Long, PaymentSummary> recentByAgency = PaymentSummary.byAgency(recent);
        Map<Long, PaymentSummary> historyByAgency = PaymentSummary.byAgency(history);

        int alerts = 0;
        for (Map.Entry<Long, PaymentSummary> entry : recentByAgency.entrySet()) {
            CanonicalEntity agency = agencies.get(entry.getKey());
            PaymentSummary now = entry.getValue();
            PaymentSummary before = historyByAgency.get(entry.getKey());
            if (agency == null || before == null
                    || now.count < RECENT_MIN_PAYMENTS || before.count < HISTORY_MIN_PAYMENTS) {
                continue;
            }
            double increase = now.confidentialRate() - before.confidentialRate();
            if (increase <= SPIKE_MIN_INCREASE) {
                continue;
            }
            String description = String.format(Locale.US,
                    "%s confidentiality rate increased from %.1f%% to %.1f%% (+%.1f%%) in the last %d days.",
                    agency.label(), before.confidentialRate() * 100, now.confidentialRate() * 100, increase * 100,
                    RECENT_DAYS);
            alerts += context.raise(new AlertRequest(SPIKE, increase >= 0.25 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                    "Confidentiality spike: " + agency.label(), description, EntityKind.AGENCY, agency.getId(),
                    new SpikeEvidence(agency.getId(), agency.label(), RuleSupport.round(now.confidentialRate() * 100, 1),
                            RuleSupport.round(before.confidentialRate() * 100, 1), RuleSupport.round(increase * 100, 1),
                            now.count, now.confidentialCount)));
        }
        return alerts;
    }

    int detectVendorRates(DetectionContext context, List<PaymentRecord> payments, Map<Long, CanonicalEntity> vendors) {
        int alerts = 0;
        for (Map.Entry<Long, PaymentSummary> entry : PaymentSummary.byVendor(payments).entrySet()) {
            CanonicalEntity vendor = vendors.get(entry.getKey());
            PaymentSummary summary = entry.getValue();
            if (vendor == null || summary.count < VENDOR_MIN_PAYMENTS || summary.confidentialRate() < VENDOR_MIN_RATE) {
                continue;
            }
            double rate = summary.confidentialRate();
            String description = String.format(Locale.US,
                    "Vendor '%s' has %s confidential payments (%d of %d). Total value: %s.",
                    vendor.label(), RuleSupport.percent(rate), summary.confidentialCount, summary.count,
                    RuleSupport.money(summary.totalAmount()));
            alerts += context.raise(new AlertRequest(VENDOR_HIGH_RATE, vendorSeverity(rate, summary.totalAmount()),
                    "High confidentiality: " + vendor.label(), description, EntityKind.VENDOR, vendor.getId(),
                    new VendorRateEvidence(vendor.getId(), vendor.label(), summary.count, summary.confidentialCount,
                            RuleSupport.round(rate * 100, 1), summary.totalAmount())));
        }
        return alerts;
    }

    static AlertSeverity vendorSeverity(double rate, double totalAmount) {
        if (rate >= 0.90 && totalAmount >= 100_000) {
            return AlertSeverity.HIGH;
        }
        return rate >= 0.75 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }
}
