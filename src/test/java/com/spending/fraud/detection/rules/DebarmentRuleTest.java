package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.Alert;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.data.InMemorySpendingDataSource;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.rules.DebarmentRule.MatchType;
import com.spending.fraud.graph.PaymentAggregate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.spending.fraud.detection.rules.RuleFixtures.alerts;
import static com.spending.fraud.detection.rules.RuleFixtures.context;
import static com.spending.fraud.detection.rules.RuleFixtures.debarred;
import static com.spending.fraud.detection.rules.RuleFixtures.number;
import static com.spending.fraud.detection.rules.RuleFixtures.vendor;
import static org.junit.jupiter.api.Assertions.*;

class DebarmentRuleTest {

    private static final String PINE_ST = "9 PINE ST HOUSTON TX 77002";
    private static final String BAY_ST = "77 BAY ST AUSTIN TX 78701";

    private final DebarmentRule rule = new DebarmentRule();

    private DetectionContext contextWithMatches() {
        return context(InMemorySpendingDataSource.builder()
                .entity(debarred(50, "Shady Contracting LLC", PINE_ST))
                .entity(debarred(51, "Crooked Builders", BAY_ST))
                .entity(vendor(1, "Shady Contracting LLC", PINE_ST))
                .entity(vendor(2, "Crooked Builder"))
                .entity(vendor(3, "Honest Roofing", BAY_ST))
                .entity(vendor(4, "Shady Contracting LLC"))
                .aggregate(PaymentAggregate.payments(1, 100, 5_000, 2))
                .aggregate(PaymentAggregate.payments(2, 100, 12_000, 3))
                .aggregate(PaymentAggregate.payments(3, 100, 2_000, 1))
                .aggregate(PaymentAggregate.payments(4, 100, 500, 1))
                .build());
    }

    private static Alert alertFor(List<Alert> alerts, long vendorId) {
        return alerts.stream().filter(a -> a.entityId() == vendorId).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Should flag paid vendors by exact name, fuzzy name and address")
    void testMatches() {
        DetectionContext context = contextWithMatches();

        assertEquals(3, rule.detect(context));

        List<Alert> alerts = alerts(context, DebarmentRule.ALERT_TYPE);
        Alert exact = alertFor(alerts, 1);
        assertEquals(AlertSeverity.HIGH, exact.severity());
        assertEquals("exact_name", exact.evidence().get("match_type"));
        Map<?, ?> exclusion = (Map<?, ?>) exact.evidence().get("exclusion");
        assertEquals("S4MR350", exclusion.get("sam_number"));
        assertEquals("SAM", exclusion.get("source"));
        Map<?, ?> payments = (Map<?, ?>) exact.evidence().get("payments");
        assertEquals(5_000.0, ((Number) payments.get("total_amount")).doubleValue());

        Alert fuzzy = alertFor(alerts, 2);
        assertEquals("fuzzy_name", fuzzy.evidence().get("match_type"));
        assertEquals(30.0 / 31.0, number(fuzzy.evidence(), "match_score"), 1e-9);
        assertEquals(AlertSeverity.HIGH, fuzzy.severity());

        Alert address = alertFor(alerts, 3);
        assertEquals("address", address.evidence().get("match_type"));
        assertEquals(AlertSeverity.LOW, address.severity());
    }

    @Test
    @DisplayName("Should skip vendors below the payment minimum")
    void testMinimumPayment() {
        DetectionContext context = contextWithMatches();

        rule.detect(context);

        assertTrue(alerts(context, DebarmentRule.ALERT_TYPE).stream().noneMatch(a -> a.entityId() == 4L));
    }

    @Test
    @DisplayName("Should not add an address match for an exclusion already matched by name")
    void testNoDuplicateAddressMatch() {
        DetectionContext context = contextWithMatches();

        rule.detect(context);

        assertEquals(2, context.store().queryPairs(RelationType.EXCLUSION_NAME).size());
        assertEquals(1, context.store().queryPairs(RelationType.EXCLUSION_ADDRESS).size());
        assertEquals(3L, context.store().queryPairs(RelationType.EXCLUSION_ADDRESS).get(0).entityId1());
    }

    @Test
    @DisplayName("Should do nothing without exclusions")
    void testNoExclusions() {
        DetectionContext context = context(InMemorySpendingDataSource.builder()
                .entity(vendor(1, "Shady Contracting LLC"))
                .aggregate(PaymentAggregate.payments(1, 100, 5_000, 2))
                .build());

        assertEquals(0, rule.detect(context));
        assertEquals(0, context.store().size());
    }

    @ParameterizedTest
    @DisplayName("Should grade matches by type and score")
    @CsvSource({
            "EXACT_NAME, 1.0, HIGH",
            "FUZZY_NAME, 0.96, HIGH",
            "FUZZY_NAME, 0.92, MEDIUM",
            "ADDRESS, 0.85, LOW"
    })
    void testSeverity(MatchType type, double score, AlertSeverity expected) {
        assertEquals(expected, DebarmentRule.severityFor(type, score));
    }
}
