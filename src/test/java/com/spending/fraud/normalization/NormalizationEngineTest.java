package com.spending.fraud.normalization;

import com.spending.fraud.core.model.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should return an empty string for null and blank names")
    void testNullAndBlank() {
        assertEquals("", engine.apply(null, EntityKind.VENDOR));
        assertEquals("", engine.apply("   ", EntityKind.VENDOR));
    }

    @ParameterizedTest
    @DisplayName("Should standardize business suffixes")
    @CsvSource({
            "Acme Incorporated,ACME INC",
            "Acme Corporation,ACME CORP",
            "Acme L.L.C.,ACME LLC",
            "Smith & Jones Company,SMITH AND JONES CO"
    })
    void testBusinessSuffixes(String input, String expected) {
        assertEquals(expected, engine.apply(input, EntityKind.VENDOR));
    }

    @Test
    @DisplayName("Should apply person rules only to person kinds")
    void testKindScopedRules() {
        assertEquals("JOHN SMITH", engine.apply("Dr. John Smith Jr.", EntityKind.EMPLOYEE));
        assertEquals("JOHN SMITH", engine.apply("Mr John Smith", EntityKind.CONTRIBUTOR));
        assertEquals("DR JOHN SMITH JR", engine.apply("Dr. John Smith Jr.", EntityKind.VENDOR));
    }

    @Test
    @DisplayName("Should skip kind-scoped rules for names without a kind")
    void testNullKind() {
        assertEquals("MR JOHN SMITH", engine.apply("Mr John Smith", null));
    }

    @Test
    @DisplayName("Should run rules in priority order regardless of list order")
    void testPriorityOrder() {
        NormalizationEngine ordered = new NormalizationEngine(List.of(
                NormalizationRule.global("second", "B", "C", 20),
                NormalizationRule.global("first", "A", "B", 10)));

        assertEquals("C", ordered.apply("a", EntityKind.VENDOR));
        assertEquals(List.of("first", "second"), ordered.getRules().stream().map(NormalizationRule::name).toList());
    }

    @Test
    @DisplayName("Should treat an unscoped rule as applying to every kind")
    void testAppliesTo() {
        NormalizationRule global = NormalizationRule.global("g", "X", "", 1);
        NormalizationRule scoped = NormalizationRule.forKinds("s", "X", "", 1, EntityKind.EMPLOYEE);

        assertTrue(global.appliesTo(null));
        assertTrue(global.appliesTo(EntityKind.AGENCY));
        assertTrue(scoped.appliesTo(EntityKind.EMPLOYEE));
        assertFalse(scoped.appliesTo(EntityKind.VENDOR));
        assertFalse(scoped.appliesTo(null));
    }
}
