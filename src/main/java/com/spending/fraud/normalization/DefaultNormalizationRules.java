package com.spending.fraud.normalization;

import com.spending.fraud.core.model.EntityKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in rule set and token tables for vendor, person and address canonicalization.
 */
public final class DefaultNormalizationRules {

    /**
     * Standardized business suffix tokens. Dropped from the name core used for blocking.
     */
    public static final Set<String> BUSINESS_SUFFIXES = Set.of(
            "LLC", "INC", "CORP", "CO", "LTD", "LP", "LLP", "PLLC", "PC", "DBA");

    /**
     * Words removed from multi-word names.
     */
    public static final Set<String> FILLER_WORDS = Set.of("THE", "OF", "AND", "FOR", "A", "AN");

    public static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("INTL", "INTERNATIONAL"),
            Map.entry("INT'L", "INTERNATIONAL"),
            Map.entry("NATL", "NATIONAL"),
            Map.entry("NAT'L", "NATIONAL"),
            Map.entry("SVCS", "SERVICES"),
            Map.entry("SVC", "SERVICE"),
            Map.entry("MGMT", "MANAGEMENT"),
            Map.entry("MGT", "MANAGEMENT"),
            Map.entry("ASSOC", "ASSOCIATES"),
            Map.entry("ASSN", "ASSOCIATION"),
            Map.entry("GRP", "GROUP"),
            Map.entry("SYS", "SYSTEMS"),
            Map.entry("TECH", "TECHNOLOGY"),
            Map.entry("TECHS", "TECHNOLOGIES"),
            Map.entry("GOVT", "GOVERNMENT"),
            Map.entry("GOV", "GOVERNMENT"),
            Map.entry("UNIV", "UNIVERSITY"),
            Map.entry("HOSP", "HOSPITAL"),
            Map.entry("MED", "MEDICAL"),
            Map.entry("CTR", "CENTER"),
            Map.entry("CNTR", "CENTER")
    );

    public static final Map<String, String> STREET_TYPES = Map.ofEntries(
            Map.entry("AVENUE", "AVE"), Map.entry("AVE", "AVE"),
            Map.entry("BOULEVARD", "BLVD"), Map.entry("BLVD", "BLVD"),
            Map.entry("CIRCLE", "CIR"), Map.entry("CIR", "CIR"),
            Map.entry("COURT", "CT"), Map.entry("CT", "CT"),
            Map.entry("DRIVE", "DR"), Map.entry("DR", "DR"),
            Map.entry("EXPRESSWAY", "EXPY"), Map.entry("EXPY", "EXPY"),
            Map.entry("FREEWAY", "FWY"), Map.entry("FWY", "FWY"),
            Map.entry("HIGHWAY", "HWY"), Map.entry("HWY", "HWY"),
            Map.entry("LANE", "LN"), Map.entry("LN", "LN"),
            Map.entry("PARKWAY", "PKWY"), Map.entry("PKWY", "PKWY"),
            Map.entry("PLACE", "PL"), Map.entry("PL", "PL"),
            Map.entry("ROAD", "RD"), Map.entry("RD", "RD"),
            Map.entry("STREET", "ST"), Map.entry("ST", "ST"),
            Map.entry("TERRACE", "TER"), Map.entry("TER", "TER"),
            Map.entry("TRAIL", "TRL"), Map.entry("TRL", "TRL"),
            Map.entry("WAY", "WAY")
    );

    public static final Map<String, String> DIRECTIONS = Map.ofEntries(
            Map.entry("NORTH", "N"), Map.entry("SOUTH", "S"),
            Map.entry("EAST", "E"), Map.entry("WEST", "W"),
            Map.entry("NORTHEAST", "NE"), Map.entry("NORTHWEST", "NW"),
            Map.entry("SOUTHEAST", "SE"), Map.entry("SOUTHWEST", "SW")
    );

    public static final Map<String, String> UNIT_TYPES = Map.ofEntries(
            Map.entry("APARTMENT", "APT"), Map.entry("APT", "APT"),
            Map.entry("BUILDING", "BLDG"), Map.entry("BLDG", "BLDG"),
            Map.entry("FLOOR", "FL"), Map.entry("FL", "FL"),
            Map.entry("SUITE", "STE"), Map.entry("STE", "STE"),
            Map.entry("UNIT", "UNIT"), Map.entry("#", "UNIT"),
            Map.entry("ROOM", "RM"), Map.entry("RM", "RM")
    );

    public static final Map<String, String> STATE_NAMES = Map.of(
            "TEXAS", "TX",
            "OKLAHOMA", "OK",
            "NEW MEXICO", "NM",
            "ARKANSAS", "AR",
            "LOUISIANA", "LA"
    );

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default name rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getBusinessSuffixRules());
        rules.addAll(getPersonRules());
        rules.addAll(getCommonRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Business suffix standardization. Dotted forms run first so that the periods
     * survive until they are matched.
     */
    public static List<NormalizationRule> getBusinessSuffixRules() {
        return List.of(
                NormalizationRule.global("suffix-pllc", "\\bP\\.L\\.L\\.C\\.?(?!\\w)", "PLLC", 5),
                NormalizationRule.global("suffix-llp-dotted", "\\bL\\.L\\.P\\.?(?!\\w)", "LLP", 6),
                NormalizationRule.global("suffix-llc-dotted", "\\bL\\.L\\.C\\.?(?!\\w)", "LLC", 7),
                NormalizationRule.global("suffix-lp-dotted", "\\bL\\.P\\.?(?!\\w)", "LP", 8),
                NormalizationRule.global("suffix-pc-dotted", "\\bP\\.C\\.?(?!\\w)", "PC", 8),
                NormalizationRule.global("suffix-dba", "\\b(?:D/B/A|D\\.B\\.A)\\.?(?!\\w)", "DBA", 8),
                NormalizationRule.global("suffix-inc", "\\b(?:INCORPORATED|INC)\\b\\.?", "INC", 10),
                NormalizationRule.global("suffix-corp", "\\b(?:CORPORATION|CORP)\\b\\.?", "CORP", 10),
                NormalizationRule.global("suffix-co", "\\b(?:COMPANY|CO)\\b\\.?", "CO", 10),
                NormalizationRule.global("suffix-ltd", "\\b(?:LIMITED|LTD)\\b\\.?", "LTD", 10)
        );
    }

    /**
     * Rules for person names, scoped to employees and contributors.
     */
    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.forKinds("person-title", "^(?:MR|MRS|MS|DR)\\.?\\s+", "", 20,
                        EntityKind.EMPLOYEE, EntityKind.CONTRIBUTOR),
                NormalizationRule.forKinds("person-generational-suffix", ",?\\s+(?:JR|SR|JUNIOR|SENIOR)\\.?$", "", 20,
                        EntityKind.EMPLOYEE, EntityKind.CONTRIBUTOR)
        );
    }

    /**
     * Rules that apply to every kind.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Apostrophes and hyphens are kept
                NormalizationRule.global("common-punctuation", "[.,;:!?\"()\\[\\]{}]", "", 100),
                NormalizationRule.global("common-ampersand", "\\s*&\\s*", " AND ", 110),
                NormalizationRule.global("common-collapse-spaces", "\\s+", " ", 200)
        );
    }
}
