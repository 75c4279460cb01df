package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.detection.DetectionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static com.spending.fraud.detection.rules.RuleFixtures.agency;
import static com.spending.fraud.detection.rules.RuleFixtures.alerts;
import static com.spending.fraud.detection.rules.RuleFixtures.context;
import static com.spending.fraud.detection.rules.RuleFixtures.number;
import static com.spending.fraud.detection.rules.RuleFixtures.vendor;
import static org.junit.jupiter.api.Assertions.*;

class ConfidentialityRuleTest {

    private static final LocalDate OLD = LocalDate.of(2022, 2, 1);
    private static final LocalDate LAST_SUMMER = LocalDate.of(2023, 6, 1);
    private static final LocalDate THIS_WINTER = LocalDate.of(2024, 1, 10);

    private final ConfidentialityRule rule = new ConfidentialityRule();

    /**
     * Adds {@code total} payments, the first {@code confidential} of them flagged, one day apart.
     */
    private static void payments(InMemorySpendingDataSource.Builder data, long vendorId, long agencyId, int total,
                                 int confidential, String amount, LocalDate from) {
        for (int i = 0; i < total; i++) {
            LocalDate date = from.plusDays(i % 30);
            if (i < confidential) {
                data.confidentialPayment(vendorId, agencyId, amount, date);
            } else {
                data.payment(vendorId, agencyId, amount, date);
            }
        }
    }

    @Nested
    @DisplayName("Agency confidentiality rates")
    class AgencyRates {

        @Test
        @DisplayName("Should flag agencies above the rate threshold with enough payments")
        void testHighRate() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Secure Couriers"))
                    .entity(vendor(2, "Quiet Investigations"))
                    .entity(agency(100, "Department of Public Safety"))
                    .entity(agency(200, "Small Board"));
            payments(data, 1, 100, 100, 25, "1000", OLD);
            payments(data, 2, 200, 99, 49, "1000", OLD);
            DetectionContext context = context(data.build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, ConfidentialityRule.HIGH_RATE).get(0);
            assertEquals(EntityKind.AGENCY, alert.entityKind());
            assertEquals(100L, alert.entityId());
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(25.0, number(alert.evidence(), "confidentiality_rate"));
            assertEquals(25_000.0, number(alert.evidence(), "confidential_amount"));
        }

        @Test
        @DisplayName("Should honor a configured rate threshold")
        void testThresholdOverride() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Secure Couriers"))
                    .entity(agency(100, "Department of Public Safety"));
            payments(data, 1, 100, 100, 25, "1000", OLD);
            DetectionContext base = context(data.build());
            DetectionContext strict = base.toBuilder()
                    .thresholds(base.thresholds().with("confidentiality_rate_threshold", 0.30))
                    .build();

            assertEquals(0, rule.detect(strict));
        }
    }

    @Nested
    @DisplayName("Recent increases")
    class Spikes {

        @Test
        @DisplayName("Should compare the last ninety days with the rest of the year")
        void testSpike() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(3, "Records Storage Inc"))
                    .entity(vendor(4, "Filing Systems LLC"))
                    .entity(agency(300, "Health Commission"))
                    .entity(agency(400, "Water Board"));
            payments(data, 3, 300, 200, 10, "500", LAST_SUMMER);
            payments(data, 3, 300, 50, 13, "500", THIS_WINTER);
            payments(data, 4, 400, 100, 10, "500", LAST_SUMMER);
            payments(data, 4, 400, 50, 9, "500", THIS_WINTER);
            DetectionContext context = context(data.build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, ConfidentialityRule.SPIKE).get(0);
            assertEquals(300L, alert.entityId());
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(5.0, number(alert.evidence(), "historical_rate"));
            assertEquals(26.0, number(alert.evidence(), "recent_rate"));
            assertEquals(21.0, number(alert.evidence(), "increase"));
            assertEquals(13, (int) number(alert.evidence(), "recent_confidential"));
        }

        @Test
        @DisplayName("Should ignore history older than a year")
        void testOldHistory() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(3, "Records Storage Inc"))
                    .entity(agency(300, "Health Commission"));
            payments(data, 3, 300, 200, 0, "500", OLD);
            payments(data, 3, 300, 50, 13, "500", THIS_WINTER);

            assertEquals(0, rule.detect(context(data.build())));
        }
    }

    @Nested
    @DisplayName("Vendor confidentiality rates")
    class VendorRates {

        @Test
        @DisplayName("Should flag vendors paid mostly through confidential payments")
        void testVendorRate() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(5, "Undisclosed Partners"))
                    .entity(vendor(6, "Too Few LLC"))
                    .entity(vendor(7, "Mostly Open Co"));
            payments(data, 5, 500, 10, 9, "20000", OLD);
            payments(data, 6, 500, 9, 9, "20000", OLD);
            payments(data, 7, 500, 10, 4, "20000", OLD);
            DetectionContext context = context(data.build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, ConfidentialityRule.VENDOR_HIGH_RATE).get(0);
            assertEquals(5L, alert.entityId());
            assertEquals(AlertSeverity.HIGH, alert.severity());
            assertEquals(90.0, number(alert.evidence(), "confidential_rate"));
        }
    }

    @ParameterizedTest
    @DisplayName("Should grade vendor rates, requiring volume for HIGH")
    @CsvSource({
            "0.5,500000,LOW",
            "0.75,0,MEDIUM",
            "0.95,99999,MEDIUM",
            "0.9,100000,HIGH"
    })
    void testVendorSeverity(double rate, double total, AlertSeverity expected) {
        assertEquals(expected, ConfidentialityRule.vendorSeverity(rate, total));
    }
}
