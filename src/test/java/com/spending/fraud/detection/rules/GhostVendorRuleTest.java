package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.detection.DetectionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.spending.fraud.detection.rules.RuleFixtures.alerts;
import static com.spending.fraud.detection.rules.RuleFixtures.context;
import static com.spending.fraud.detection.rules.RuleFixtures.number;
import static com.spending.fraud.detection.rules.RuleFixtures.vendor;
import static org.junit.jupiter.api.Assertions.*;

class GhostVendorRuleTest {

    private static final LocalDate PAID = LocalDate.of(2023, 11, 2);

    private final GhostVendorRule rule = new GhostVendorRule();

    private static Map<String, Object> registered(Boolean inCmbl, String street, String city, String zip) {
        Map<String, Object> attrs = new HashMap<>();
        if (inCmbl != null) {
            attrs.put(CanonicalEntity.ATTR_IN_CMBL, inCmbl);
        }
        attrs.put(CanonicalEntity.ATTR_ADDRESS, street);
        if (city != null) {
            attrs.put(CanonicalEntity.ATTR_CITY, city);
        }
        attrs.put(CanonicalEntity.ATTR_STATE, "TX");
        if (zip != null) {
            attrs.put(CanonicalEntity.ATTR_ZIP, zip);
        }
        return attrs;
    }

    private static CanonicalEntity complete(long id, String name, boolean inCmbl) {
        Map<String, Object> attrs = registered(inCmbl, "1200 Congress Ave", "Austin", "78701");
        attrs.put(CanonicalEntity.ATTR_PHONE, "512-555-0100");
        attrs.put(CanonicalEntity.ATTR_VENDOR_CODE, "17412345670");
        return vendor(id, name, null, attrs);
    }

    @Nested
    @DisplayName("Vendors outside the CMBL")
    class NonCmbl {

        @Test
        @DisplayName("Should flag a paid vendor missing from the CMBL even without red flags")
        void testNonCmblVendor() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(complete(1, "Lone Star Supply", false))
                    .payment(1, 100, "30000", PAID)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, GhostVendorRule.GHOST_VENDOR).get(0);
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(1L, alert.entityId());
            assertEquals(30_000.0, number(alert.evidence(), "total_payments"));
            assertEquals(List.of(), alert.evidence().get("red_flags"));
            assertEquals(false, alert.evidence().get("in_cmbl"));
        }

        @Test
        @DisplayName("Should raise HIGH with three or more red flags")
        void testRedFlags() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(2, "Phantom Services", null, registered(false, "12 Oak St", null, "78701")))
                    .payment(2, 100, "10000", PAID)
                    .payment(2, 200, "10000", PAID.plusDays(3))
                    .payment(2, 300, "10000", PAID.plusDays(9))
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, GhostVendorRule.GHOST_VENDOR).get(0);
            assertEquals(AlertSeverity.HIGH, alert.severity());
            assertEquals(List.of("No state vendor ID", "Incomplete address", "No phone number",
                    "Payments from 3 different agencies"), alert.evidence().get("red_flags"));
            assertEquals(3, (int) number(alert.evidence(), "agency_count"));
            assertEquals("2023-11-02", alert.evidence().get("first_payment"));
            assertEquals("2023-11-11", alert.evidence().get("last_payment"));
        }

        @Test
        @DisplayName("Should ignore vendors below the payment minimum or with unknown registration")
        void testSkipped() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(complete(3, "Small Fry LLC", false))
                    .entity(vendor(4, "Unknown Status Co", null, registered(null, "1 Elm St", null, null)))
                    .payment(3, 100, "20000", PAID)
                    .payment(4, 100, "90000", PAID)
                    .build());

            assertEquals(0, rule.detect(context));
        }

        @Test
        @DisplayName("Should honor a configured payment minimum")
        void testThresholdOverride() {
            DetectionContext base = context(InMemorySpendingDataSource.builder()
                    .entity(complete(3, "Small Fry LLC", false))
                    .payment(3, 100, "20000", PAID)
                    .build());
            DetectionContext context = base.toBuilder()
                    .thresholds(base.thresholds().with("ghost_vendor_min_payment", 15_000))
                    .build();

            assertEquals(1, rule.detect(context));
        }
    }

    @Nested
    @DisplayName("Registered vendor addresses")
    class Addresses {

        @Test
        @DisplayName("Should list the missing fields of an incomplete address")
        void testIncompleteAddress() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(5, "Half Address Inc", null, registered(true, "400 Lamar Blvd", null, null)))
                    .payment(5, 100, "40000", PAID)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, GhostVendorRule.INCOMPLETE_ADDRESS).get(0);
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(List.of("city", "ZIP code"), alert.evidence().get("missing_fields"));
            assertTrue(alerts(context, GhostVendorRule.GHOST_VENDOR).isEmpty());
        }

        @Test
        @DisplayName("Should flag a mail drop receiving large payments")
        void testPoBox() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(6, "Box Holdings", null, registered(true, "PO Box 1234", "Austin", "78701")))
                    .payment(6, 100, "300000", PAID)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, GhostVendorRule.SUSPICIOUS_ADDRESS).get(0);
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(List.of("po box"), alert.evidence().get("suspicious_patterns"));
            assertEquals(List.of("po box", "Large payments to PO Box address"), alert.evidence().get("red_flags"));
        }

        @Test
        @DisplayName("Should treat placeholder addresses as suspicious")
        void testPlaceholder() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(7, "Nowhere LLC", null, registered(true, "Unknown", "Austin", "78701")))
                    .payment(7, 100, "26000", PAID)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, GhostVendorRule.SUSPICIOUS_ADDRESS).get(0);
            assertEquals(AlertSeverity.LOW, alert.severity());
            assertEquals(List.of("unknown", "Very short address"), alert.evidence().get("red_flags"));
        }
    }

    @ParameterizedTest
    @DisplayName("Should grade suspicious addresses by amount and red flags")
    @CsvSource({
            "50000,1,LOW",
            "100000,1,MEDIUM",
            "500000,1,HIGH",
            "50000,3,HIGH"
    })
    void testSuspiciousSeverity(double total, int flags, AlertSeverity expected) {
        assertEquals(expected, GhostVendorRule.suspiciousSeverity(total, flags));
    }

    @Test
    @DisplayName("Should grade non-CMBL and incomplete address alerts")
    void testOtherSeverities() {
        assertEquals(AlertSeverity.MEDIUM, GhostVendorRule.nonCmblSeverity(499_999, 2));
        assertEquals(AlertSeverity.HIGH, GhostVendorRule.nonCmblSeverity(500_000, 0));
        assertEquals(AlertSeverity.MEDIUM, GhostVendorRule.incompleteSeverity(99_999, 2));
        assertEquals(AlertSeverity.HIGH, GhostVendorRule.incompleteSeverity(10_000, 3));
    }
}
