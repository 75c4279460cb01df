package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.ContractRecord;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.detection.DetectionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.spending.fraud.detection.rules.RuleFixtures.agency;
import static com.spending.fraud.detection.rules.RuleFixtures.alerts;
import static com.spending.fraud.detection.rules.RuleFixtures.context;
import static com.spending.fraud.detection.rules.RuleFixtures.number;
import static com.spending.fraud.detection.rules.RuleFixtures.vendor;
import static org.junit.jupiter.api.Assertions.*;

class PaymentAnomalyRuleTest {

    private static final LocalDate JAN_8 = LocalDate.of(2024, 1, 8);

    private final PaymentAnomalyRule rule = new PaymentAnomalyRule();

    private static CanonicalEntity seen(long id, String name, String firstSeen) {
        return vendor(id, name, null, Map.of(CanonicalEntity.ATTR_FIRST_SEEN, firstSeen));
    }

    @Nested
    @DisplayName("Round-number payments")
    class RoundNumbers {

        @Test
        @DisplayName("Should flag a vendor paid the same round amount in half its payments")
        void testRoundNumbers() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Even Steven Consulting"))
                    .entity(vendor(2, "Four Tens LLC"));
            for (int i = 0; i < 5; i++) {
                data.payment(1, 100, "25000", JAN_8.plusDays(i));
                data.payment(1, 100, "1234.56", JAN_8.plusDays(i));
                data.payment(2, 100, "10000", JAN_8.plusDays(i * 7L));
            }
            data.payment(2, 100, "99.99", JAN_8);
            DetectionContext context = context(data.build());

            assertEquals(2, rule.detect(context));

            List<Alert> alerts = alerts(context, PaymentAnomalyRule.ROUND_NUMBERS);
            assertEquals(2, alerts.size());
            Alert half = alerts.stream().filter(a -> a.entityId() == 1L).findFirst().orElseThrow();
            assertEquals(AlertSeverity.MEDIUM, half.severity());
            assertEquals(50.0, number(half.evidence(), "round_percentage"));
            assertEquals(5, (int) number(half.evidence(), "round_count"));
            assertEquals(125_000.0, number(half.evidence(), "total_round_value"));

            Alert mostly = alerts.stream().filter(a -> a.entityId() == 2L).findFirst().orElseThrow();
            assertEquals(AlertSeverity.MEDIUM, mostly.severity());
            assertEquals(83.3, number(mostly.evidence(), "round_percentage"));
        }

        @Test
        @DisplayName("Should require five payments that make a quarter of the vendor's payments")
        void testNotEnough() {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Mostly Odd Inc"))
                    .entity(vendor(2, "Few Rounds Co"));
            for (int i = 0; i < 21; i++) {
                data.payment(1, 100, i < 5 ? "50000" : "777.77", JAN_8.plusDays(i));
            }
            for (int i = 0; i < 4; i++) {
                data.payment(2, 100, "10000", JAN_8.plusDays(i));
            }

            assertEquals(0, rule.detect(context(data.build())));
        }
    }

    @Nested
    @DisplayName("Large first payments")
    class LargeFirstPayments {

        @Test
        @DisplayName("Should flag large first payments to vendors that are new or of unknown age")
        void testLargeFirstPayments() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(seen(3, "Fresh Start Builders", "2023-12-01"))
                    .entity(vendor(4, "No History Corp"))
                    .entity(seen(5, "Old Reliable Co", "2020-01-01"))
                    .entity(vendor(6, "Slow Ramp LLC"))
                    .entity(agency(100, "Parks and Wildlife"))
                    .payment(3, 100, "150000", JAN_8)
                    .payment(4, 100, "600000", JAN_8)
                    .payment(5, 100, "400000", JAN_8)
                    .payment(6, 100, "50000", JAN_8)
                    .payment(6, 100, "200000", JAN_8.plusDays(30))
                    .build());

            assertEquals(2, rule.detect(context));

            List<Alert> alerts = alerts(context, PaymentAnomalyRule.LARGE_FIRST_PAYMENT);
            Alert fresh = alerts.stream().filter(a -> a.entityId() == 3L).findFirst().orElseThrow();
            assertEquals(AlertSeverity.MEDIUM, fresh.severity());
            assertEquals("2023-12-01", fresh.evidence().get("vendor_first_seen"));
            assertEquals("Parks and Wildlife", fresh.evidence().get("agency"));
            Alert unknown = alerts.stream().filter(a -> a.entityId() == 4L).findFirst().orElseThrow();
            assertEquals(AlertSeverity.HIGH, unknown.severity());
        }
    }

    @Nested
    @DisplayName("Payments over a contract ceiling")
    class OverContract {

        @Test
        @DisplayName("Should compare the agency's payments to the vendor against the contract maximum")
        void testOverContract() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(7, "Scope Creep Engineering"))
                    .entity(agency(100, "Department of Transportation"))
                    .contract(new ContractRecord(500, "TX-2023-0042", 7, 100, new BigDecimal("90000"),
                            LocalDate.of(2023, 9, 1), "Bridge inspection", new BigDecimal("100000")))
                    .contract(new ContractRecord(501, "TX-2023-0043", 7, 200, new BigDecimal("10000"),
                            LocalDate.of(2023, 9, 1), "Signage", new BigDecimal("500000")))
                    .payment(7, 100, "65000", JAN_8)
                    .payment(7, 100, "65000", JAN_8.plusDays(20))
                    .payment(7, 200, "90000", JAN_8)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, PaymentAnomalyRule.OVER_CONTRACT).get(0);
            assertEquals(EntityKind.CONTRACT, alert.entityKind());
            assertEquals(500L, alert.entityId());
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(30_000.0, number(alert.evidence(), "excess_amount"));
            assertEquals(30.0, number(alert.evidence(), "excess_percentage"));
            assertEquals("Department of Transportation", alert.evidence().get("agency_name"));
        }
    }

    @Nested
    @DisplayName("Fiscal year end spikes")
    class FiscalYearEnd {

        @Test
        @DisplayName("Should report an agency's most recent August spike once")
        void testSpike() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(8, "Year End Supply"))
                    .entity(agency(200, "General Land Office"))
                    .entity(agency(300, "Steady Agency"))
                    .payment(8, 200, "75000", LocalDate.of(2022, 1, 14))
                    .payment(8, 200, "25000", LocalDate.of(2022, 8, 20))
                    .payment(8, 200, "60000", LocalDate.of(2022, 10, 3))
                    .payment(8, 200, "40000", LocalDate.of(2023, 8, 30))
                    .payment(8, 300, "90000", LocalDate.of(2023, 3, 1))
                    .payment(8, 300, "10000", LocalDate.of(2023, 8, 2))
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, PaymentAnomalyRule.FY_END_SPIKE).get(0);
            assertEquals(EntityKind.AGENCY, alert.entityKind());
            assertEquals(200L, alert.entityId());
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(2023, (int) number(alert.evidence(), "fiscal_year"));
            assertEquals(40.0, number(alert.evidence(), "august_percentage"));
        }

        @Test
        @DisplayName("Should ignore the fiscal year still in progress")
        void testCurrentYearIgnored() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(8, "Year End Supply"))
                    .entity(agency(200, "General Land Office"))
                    .payment(8, 200, "10000", LocalDate.of(2023, 9, 3))
                    .payment(8, 200, "20000", LocalDate.of(2023, 9, 4))
                    .build());

            assertEquals(0, rule.detect(context));
        }
    }
}
