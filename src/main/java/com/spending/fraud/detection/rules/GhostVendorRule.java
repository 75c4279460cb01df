package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.normalization.NormalizedAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Vendors paid significant amounts that look unregistered or unreachable: vendors missing
 * from the Centralized Master Bidders List (CMBL), registered vendors with incomplete
 * addresses, and vendors whose address is a mail drop or a placeholder.
 */
public class GhostVendorRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(GhostVendorRule.class);

    public static final String NAME = "ghost_vendors";
    public static final String GHOST_VENDOR = "ghost_vendor";
    public static final String INCOMPLETE_ADDRESS = "incomplete_vendor_address";
    public static final String SUSPICIOUS_ADDRESS = "suspicious_vendor_address";

    static final List<String> SUSPICIOUS_PATTERNS = List.of(
            "po box", "p.o. box", "p o box", "pmb", "suite 0", "apt 0", "unit 0",
            "unknown", "n/a", "none", "general delivery");

    /**
     * Raw street line plus the components parsed or supplied for it.
     */
    record VendorAddress(String street, String city, String state, String zip) {

        boolean streetMissing() {
            return street == null || street.trim().length() < 5;
        }

        boolean incomplete() {
            return streetMissing() || city == null || state == null;
        }
    }

    public record NonCmblEvidence(long vendorId, String vendorName, String vendorCode, boolean inCmbl,
                                  double totalPayments, int paymentCount, int agencyCount, LocalDate firstPayment,
                                  LocalDate lastPayment, String address, String city, String state, String phone,
                                  List<String> redFlags) implements AlertEvidence {
    }

    public record IncompleteAddressEvidence(long vendorId, String vendorName, double totalPayments, int paymentCount,
                                            String address, String city, String state, String zipCode,
                                            List<String> missingFields) implements AlertEvidence {
    }

    public record SuspiciousAddressEvidence(long vendorId, String vendorName, double totalPayments,
                                            int paymentCount, String address, String city, String state,
                                            List<String> suspiciousPatterns,
                                            List<String> redFlags) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Ghost Vendors";
    }

    @Override
    public int detect(DetectionContext context) {
        double minPayment = context.thresholds().getDouble("ghost_vendor_min_payment", 25_000);
        Map<Long, PaymentSummary> summaries = PaymentSummary.byVendor(context.data().allPayments());
        Map<Long, CanonicalEntity> vendors = RuleSupport.byId(context.data().vendors());
        log.info("ghost_vendors.start vendors={} paid={} minPayment={}", vendors.size(), summaries.size(), minPayment);

        int alerts = 0;
        for (Map.Entry<Long, PaymentSummary> entry : summaries.entrySet()) {
            CanonicalEntity vendor = vendors.get(entry.getKey());
            PaymentSummary summary = entry.getValue();
            if (vendor == null || summary.totalAmount() < minPayment) {
                continue;
            }
            VendorAddress address = addressOf(context, vendor);
            Boolean inCmbl = vendor.booleanAttribute(CanonicalEntity.ATTR_IN_CMBL);
            if (Boolean.FALSE.equals(inCmbl)) {
                alerts += context.raise(nonCmblAlert(vendor, summary, address));
            }
            // non-CMBL vendors already carry a ghost vendor alert
            if (Boolean.TRUE.equals(inCmbl) && address.incomplete()) {
                alerts += context.raise(incompleteAddressAlert(vendor, summary, address));
            }
            List<String> patterns = suspiciousPatterns(address.street());
            if (!patterns.isEmpty()) {
                alerts += context.raise(suspiciousAddressAlert(vendor, summary, address, patterns));
            }
        }
        return alerts;
    }

    static VendorAddress addressOf(DetectionContext context, CanonicalEntity vendor) {
        String street = vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS);
        String city = vendor.stringAttribute(CanonicalEntity.ATTR_CITY);
        String state = vendor.stringAttribute(CanonicalEntity.ATTR_STATE);
        String zip = vendor.stringAttribute(CanonicalEntity.ATTR_ZIP);
        if (street != null && city == null && state == null && zip == null) {
            NormalizedAddress parsed = context.addresses().canonicalize(street);
            if (parsed != null) {
                city = parsed.city();
                state = parsed.state();
                zip = parsed.zip();
            }
        }
        return new VendorAddress(street, city, state, zip);
    }

    static List<String> suspiciousPatterns(String street) {
        if (street == null) {
            return List.of();
        }
        String lower = street.toLowerCase(Locale.ROOT);
        return SUSPICIOUS_PATTERNS.stream().filter(lower::contains).toList();
    }

    static AlertSeverity nonCmblSeverity(double total, int redFlags) {
        return total >= 500_000 || redFlags >= 3 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
    }

    static AlertSeverity incompleteSeverity(double total, int missingFields) {
        return total >= 100_000 || missingFields >= 3 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
    }

    static AlertSeverity suspiciousSeverity(double total, int redFlags) {
        if (total >= 500_000 || redFlags >= 3) {
            return AlertSeverity.HIGH;
        }
        return total >= 100_000 ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
    }

    private AlertRequest nonCmblAlert(CanonicalEntity vendor, PaymentSummary summary, VendorAddress address) {
        String vendorCode = vendor.stringAttribute(CanonicalEntity.ATTR_VENDOR_CODE);
        String phone = vendor.stringAttribute(CanonicalEntity.ATTR_PHONE);
        List<String> redFlags = new ArrayList<>();
        if (vendorCode == null || vendorCode.isBlank()) {
            redFlags.add("No state vendor ID");
        }
        if (address.incomplete()) {
            redFlags.add("Incomplete address");
        }
        if (phone == null || phone.isBlank()) {
            redFlags.add("No phone number");
        }
        if (summary.agencies.size() >= 3) {
            redFlags.add("Payments from " + summary.agencies.size() + " different agencies");
        }

        String description = String.format(Locale.US,
                "Vendor '%s' has received %s across %d payments from %d agencies but is not registered in "
                        + "the Centralized Master Bidders List (CMBL). Red flags: %s.",
                vendor.label(), RuleSupport.money(summary.totalAmount()), summary.count, summary.agencies.size(),
                redFlags.isEmpty() ? "None" : String.join(", ", redFlags));
        return new AlertRequest(GHOST_VENDOR, nonCmblSeverity(summary.totalAmount(), redFlags.size()),
                "Potential ghost vendor: " + vendor.label(), description, EntityKind.VENDOR, vendor.getId(),
                new NonCmblEvidence(vendor.getId(), vendor.label(), vendorCode, false, summary.totalAmount(),
                        summary.count, summary.agencies.size(), summary.first, summary.last, address.street(),
                        address.city(), address.state(), phone, List.copyOf(redFlags)));
    }

    private AlertRequest incompleteAddressAlert(CanonicalEntity vendor, PaymentSummary summary, VendorAddress address) {
        List<String> missing = new ArrayList<>();
        if (address.streetMissing()) {
            missing.add("street address");
        }
        if (address.city() == null) {
            missing.add("city");
        }
        if (address.state() == null) {
            missing.add("state");
        }
        if (address.zip() == null) {
            missing.add("ZIP code");
        }

        String description = String.format(Locale.US,
                "Vendor '%s' has received %s in %d payments but has incomplete address information. Missing: %s.",
                vendor.label(), RuleSupport.money(summary.totalAmount()), summary.count, String.join(", ", missing));
        return new AlertRequest(INCOMPLETE_ADDRESS, incompleteSeverity(summary.totalAmount(), missing.size()),
                "Vendor with incomplete address: " + vendor.label(), description, EntityKind.VENDOR, vendor.getId(),
                new IncompleteAddressEvidence(vendor.getId(), vendor.label(), summary.totalAmount(), summary.count,
                        address.street(), address.city(), address.state(), address.zip(), List.copyOf(missing)));
    }

    private AlertRequest suspiciousAddressAlert(CanonicalEntity vendor, PaymentSummary summary, VendorAddress address,
                                                List<String> patterns) {
        List<String> redFlags = new ArrayList<>(patterns);
        if (patterns.stream().anyMatch(p -> p.contains("box")) && summary.totalAmount() >= 250_000) {
            redFlags.add("Large payments to PO Box address");
        }
        if (address.street().trim().length() < 10) {
            redFlags.add("Very short address");
        }

        String description = String.format(Locale.US,
                "Vendor '%s' has received %s but has a suspicious address: '%s'. Patterns found: %s. "
                        + "This may indicate a shell company or mail drop.",
                vendor.label(), RuleSupport.money(summary.totalAmount()), address.street(), String.join(", ", patterns));
        return new AlertRequest(SUSPICIOUS_ADDRESS, suspiciousSeverity(summary.totalAmount(), redFlags.size()),
                "Vendor with suspicious address: " + vendor.label(), description, EntityKind.VENDOR, vendor.getId(),
                new SuspiciousAddressEvidence(vendor.getId(), vendor.label(), summary.totalAmount(), summary.count,
                        address.street(), address.city(), address.state(), patterns, List.copyOf(redFlags)));
    }
}
