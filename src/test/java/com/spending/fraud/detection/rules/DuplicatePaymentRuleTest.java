package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.data.PaymentRecord;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.store.InMemoryRelationshipStore;
import com.spending.fraud.store.RelationshipStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

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

class DuplicatePaymentRuleTest {

    private static final LocalDate JAN_5 = LocalDate.of(2024, 1, 5);

    private final DuplicatePaymentRule rule = new DuplicatePaymentRule();

    @Nested
    @DisplayName("Same-day duplicates")
    class Exact {

        @Test
        @DisplayName("Should flag identical payments on one day once, not as near duplicates")
        void testExactDuplicates() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Copy Paste Printing"))
                    .entity(agency(100, "Department of Insurance"))
                    .payment(1, 100, "12000", JAN_5)
                    .payment(1, 100, "12000.00", JAN_5)
                    .payment(1, 100, "12000", JAN_5)
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, DuplicatePaymentRule.EXACT).get(0);
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(3, (int) number(alert.evidence(), "duplicate_count"));
            assertEquals(36_000.0, number(alert.evidence(), "total_duplicate_amount"));
            assertEquals(List.of("Department of Insurance"), alert.evidence().get("agencies"));
            assertEquals(3, ((List<?>) alert.evidence().get("payments")).size());
            assertTrue(alerts(context, DuplicatePaymentRule.NEAR).isEmpty());
        }

        @Test
        @DisplayName("Should ignore small amounts and single payments")
        void testIgnored() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Coffee Service"))
                    .payment(1, 100, "100", JAN_5)
                    .payment(1, 100, "100", JAN_5)
                    .payment(1, 100, "250", JAN_5)
                    .build());

            assertEquals(0, rule.detect(context));
        }
    }

    @Nested
    @DisplayName("Payments repeated within the window")
    class Near {

        @Test
        @DisplayName("Should cluster equal payments whose gaps stay within the window")
        void testNearDuplicates() {
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(2, "Repeat Consulting"))
                    .payment(2, 100, "8000", JAN_5)
                    .payment(2, 100, "8000", JAN_5.plusDays(15))
                    .payment(2, 100, "8000", JAN_5.plusDays(36))
                    .payment(2, 100, "8000", JAN_5.plusDays(150))
                    .build());

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, DuplicatePaymentRule.NEAR).get(0);
            assertEquals(AlertSeverity.LOW, alert.severity());
            assertEquals(3, (int) number(alert.evidence(), "payment_count"));
            assertEquals("2024-01-05 to 2024-02-10", alert.evidence().get("date_range"));
        }

        @Test
        @DisplayName("Should widen clusters when the window is configured larger")
        void testWindowOverride() {
            DetectionContext base = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(2, "Repeat Consulting"))
                    .payment(2, 100, "8000", JAN_5)
                    .payment(2, 100, "8000", JAN_5.plusDays(40))
                    .build());

            assertEquals(0, rule.detect(base));

            DetectionContext wide = base.toBuilder()
                    .thresholds(base.thresholds().with("duplicate_payment_window_days", 45))
                    .build();
            assertEquals(1, rule.detect(wide));
        }

        @Test
        @DisplayName("Should split runs at gaps longer than the window")
        void testClusters() {
            List<PaymentRecord> payments = List.of(
                    payment(1, JAN_5.plusDays(100)),
                    payment(2, JAN_5),
                    payment(3, JAN_5.plusDays(30)),
                    payment(4, JAN_5.plusDays(61)),
                    payment(5, JAN_5.plusDays(90)));

            List<List<PaymentRecord>> clusters = DuplicatePaymentRule.clusters(payments, 30);

            assertEquals(2, clusters.size());
            assertEquals(List.of(2L, 3L), clusters.get(0).stream().map(PaymentRecord::id).toList());
            assertEquals(List.of(4L, 5L, 1L), clusters.get(1).stream().map(PaymentRecord::id).toList());
        }

        private PaymentRecord payment(long id, LocalDate date) {
            return new PaymentRecord(id, 9, 100, new BigDecimal("6000"), date);
        }
    }

    @Nested
    @DisplayName("Vendors sharing an address")
    class RelatedVendors {

        @Test
        @DisplayName("Should flag the same amount paid to both vendors of a shared-address link")
        void testRelatedVendorDuplicate() {
            RelationshipStore store = new InMemoryRelationshipStore();
            store.upsert(new RelationshipEdge(EntityRef.vendor(4), EntityRef.vendor(3), RelationType.SAME_ADDRESS,
                    0.8, Map.of("address", "5 ELM ST")));
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(3, "Elm Services", "5 ELM ST"))
                    .entity(vendor(4, "Elm Solutions", "5 ELM ST"))
                    .payment(3, 100, "2500", JAN_5.plusDays(5))
                    .payment(4, 200, "2500", JAN_5.plusDays(20))
                    .payment(4, 200, "900", JAN_5.plusDays(5))
                    .build(), store);

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, DuplicatePaymentRule.RELATED_VENDOR).get(0);
            assertEquals(AlertSeverity.MEDIUM, alert.severity());
            assertEquals(3L, alert.entityId());
            assertEquals(4, (int) number(alert.evidence(), "vendor2_id"));
            assertEquals("2024-01-10", alert.evidence().get("payment1_date"));
            assertEquals("2024-01-25", alert.evidence().get("payment2_date"));
            assertEquals("5 ELM ST", alert.evidence().get("shared_address"));
        }

        @Test
        @DisplayName("Should skip linked vendors whose equal payments are too far apart")
        void testOutsideWindow() {
            RelationshipStore store = new InMemoryRelationshipStore();
            store.upsert(RelationshipEdge.of(EntityRef.vendor(3), EntityRef.vendor(4), RelationType.SAME_ADDRESS, 0.8));
            DetectionContext context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(3, "Elm Services", "5 ELM ST"))
                    .entity(vendor(4, "Elm Solutions", "5 ELM ST"))
                    .payment(3, 100, "2500", JAN_5)
                    .payment(4, 200, "2500", JAN_5.plusDays(31))
                    .build(), store);

            assertEquals(0, rule.detect(context));
        }
    }

    @ParameterizedTest
    @DisplayName("Should grade duplicates by count and amount")
    @CsvSource({
            "2,500,LOW,LOW",
            "3,500,MEDIUM,LOW",
            "4,500,MEDIUM,MEDIUM",
            "5,500,HIGH,MEDIUM",
            "2,10000,MEDIUM,LOW",
            "2,25000,MEDIUM,HIGH",
            "6,500,HIGH,HIGH",
            "2,50000,HIGH,HIGH"
    })
    void testSeverity(int count, double amount, AlertSeverity exact, AlertSeverity near) {
        assertEquals(exact, DuplicatePaymentRule.exactSeverity(count, amount));
        assertEquals(near, DuplicatePaymentRule.nearSeverity(count, amount));
    }
}
