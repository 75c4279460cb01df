package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.data.ContributionRecord;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.graph.PaymentAggregate;
import com.spending.fraud.store.InMemoryRelationshipStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.spending.fraud.detection.rules.RuleFixtures.alerts;
import static com.spending.fraud.detection.rules.RuleFixtures.context;
import static com.spending.fraud.detection.rules.RuleFixtures.contributor;
import static com.spending.fraud.detection.rules.RuleFixtures.employee;
import static com.spending.fraud.detection.rules.RuleFixtures.number;
import static com.spending.fraud.detection.rules.RuleFixtures.vendor;
import static org.junit.jupiter.api.Assertions.*;

class RelatedPartyRuleTest {

    private final RelatedPartyRule rule = new RelatedPartyRule();

    @Nested
    @DisplayName("Vendor networks")
    class VendorNetworks {

        private InMemoryRelationshipStore store;
        private DetectionContext context;

        private void givenLinkedVendors() {
            store = new InMemoryRelationshipStore();
            context = context(InMemorySpendingDataSource.builder()
                    .entity(vendor(1, "Alpha Paving"))
                    .entity(vendor(2, "Alpha Paving Services"))
                    .entity(vendor(3, "Alfa Paving"))
                    .aggregate(PaymentAggregate.payments(1, 400, 300_000, 6))
                    .aggregate(PaymentAggregate.payments(2, 400, 250_000, 4))
                    .aggregate(PaymentAggregate.payments(3, 401, 10_000, 1))
                    .build(), store);
        }

        @Test
        @DisplayName("Should use relationships recorded after the shared graph was built")
        void testNetworkAndCircularPattern() {
            givenLinkedVendors();
            context.graph();
            store.upsert(RelationshipEdge.of(EntityRef.vendor(1), EntityRef.vendor(2), RelationType.SAME_ADDRESS, 0.8));
            store.upsert(RelationshipEdge.of(EntityRef.vendor(2), EntityRef.vendor(3), RelationType.SIMILAR_NAME, 0.92));

            assertEquals(2, rule.detect(context));

            Alert network = alerts(context, "related_party_network").get(0);
            assertEquals(AlertSeverity.MEDIUM, network.severity());
            assertEquals(1L, network.entityId());
            assertEquals(3, (int) number(network.evidence(), "network_size"));
            assertEquals(560_000.0, number(network.evidence(), "total_network_value"));
            assertEquals(2, (int) number(network.evidence(), "relationship_count"));
            assertEquals(Map.of("same_address", 1, "similar_name", 1), network.evidence().get("relationship_types"));

            Alert circular = alerts(context, "circular_payment_pattern").get(0);
            assertEquals(AlertSeverity.MEDIUM, circular.severity());
            assertEquals(1, (int) number(circular.evidence(), "common_agency_count"));
            assertEquals("same_address", circular.evidence().get("relationship_type"));
        }

        @Test
        @DisplayName("Should ignore a weakly related pair")
        void testWeakPair() {
            givenLinkedVendors();
            store.upsert(RelationshipEdge.of(EntityRef.vendor(1), EntityRef.vendor(2), RelationType.SIMILAR_NAME, 0.6));

            assertEquals(0, rule.detect(context));
        }
    }

    @Nested
    @DisplayName("Employee, vendor and contributor")
    class Triangles {

        private DetectionContext triangle(String... amounts) {
            InMemorySpendingDataSource.Builder data = InMemorySpendingDataSource.builder()
                    .entity(employee(10, "John Smith", null))
                    .entity(vendor(1, "Acme Supply"))
                    .entity(contributor(20, "Acme Supply"))
                    .entity(contributor(21, "Zebra Logistics"))
                    .aggregate(PaymentAggregate.payments(1, 100, 20_000, 2));
            String[] filers = {"Friends of Smith", "Texans for Jones"};
            for (int i = 0; i < amounts.length; i++) {
                data.contribution(new ContributionRecord(i + 1, 20, new BigDecimal(amounts[i]), filers[i % 2],
                        LocalDate.of(2023, 5, 1 + i)));
            }
            data.contribution(new ContributionRecord(99, 21, new BigDecimal("50000"), "Someone Else",
                    LocalDate.of(2023, 5, 1)));
            InMemoryRelationshipStore store = new InMemoryRelationshipStore();
            store.upsert(RelationshipEdge.of(EntityRef.employee(10), EntityRef.vendor(1), RelationType.NAME, 0.95));
            return context(data.build(), store);
        }

        @Test
        @DisplayName("Should flag an employee-linked vendor that also contributes")
        void testTriangle() {
            DetectionContext context = triangle("6000", "5000");

            assertEquals(1, rule.detect(context));

            Alert alert = alerts(context, "employee_vendor_contributor_triangle").get(0);
            assertEquals(AlertSeverity.HIGH, alert.severity());
            assertEquals(EntityKind.EMPLOYEE, alert.entityKind());
            assertEquals(10L, alert.entityId());
            assertEquals("name", alert.evidence().get("match_type"));
            assertEquals(2, (int) number(alert.evidence(), "contribution_count"));
            assertEquals(11_000.0, number(alert.evidence(), "total_contributions"));
            List<?> recipients = (List<?>) alert.evidence().get("contribution_recipients");
            assertEquals("Friends of Smith", ((Map<?, ?>) recipients.get(0)).get("name"));
        }

        @Test
        @DisplayName("Should rate small contributions to a modest vendor MEDIUM")
        void testSmallContributions() {
            DetectionContext context = triangle("1500");

            assertEquals(1, rule.detect(context));
            assertEquals(AlertSeverity.MEDIUM,
                    alerts(context, "employee_vendor_contributor_triangle").get(0).severity());
        }
    }

    @ParameterizedTest
    @DisplayName("Should rate large or diverse networks HIGH")
    @CsvSource({
            "5, 600000, 1, HIGH",
            "3, 2000000, 1, HIGH",
            "3, 600000, 3, HIGH",
            "4, 600000, 2, MEDIUM"
    })
    void testNetworkSeverity(int size, double value, int types, AlertSeverity expected) {
        assertEquals(expected, RelatedPartyRule.networkSeverity(size, value, types));
    }
}
