package com.spending.fraud.normalization;

import com.spending.fraud.cache.CacheConfig;
import com.spending.fraud.cache.CanonicalizationCache;
import com.spending.fraud.similarity.IndelSimilarity;
import com.spending.fraud.similarity.SimilarityAlgorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Standardizes street addresses so that the same location written two ways compares equal.
 * Accepts either a full single-line address or separate components.
 */
public class AddressCanonicalizer {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.85;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PO_BOX = Pattern.compile("\\bP\\.?O\\.?\\s*BOX\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ZIP = Pattern.compile("\\b(\\d{5})(?:-\\d{4})?\\s*$");
    private static final Pattern TRAILING_STATE = Pattern.compile("\\b([A-Z]{2})\\s*$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private final SimilarityAlgorithm streetSimilarity;
    private final CanonicalizationCache<NormalizedAddress> cache;

    public AddressCanonicalizer() {
        this(new IndelSimilarity(), CacheConfig.disabled());
    }

    public AddressCanonicalizer(SimilarityAlgorithm streetSimilarity, CacheConfig cacheConfig) {
        this.streetSimilarity = streetSimilarity;
        this.cache = CanonicalizationCache.create(cacheConfig);
    }

    /**
     * Parses a full address string such as {@code "123 Main Street, Austin, TX 78701"}.
     *
     * @return the normalized address, or null for null or blank input
     */
    public NormalizedAddress canonicalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return cache.get(address, this::parseFull);
    }

    /**
     * Normalizes separately supplied components. Falls back to full-string parsing when
     * no city, state or zip is given.
     *
     * @return the normalized address, or null when every component is blank
     */
    public NormalizedAddress canonicalize(String street, String city, String state, String zip) {
        if (isBlank(city) && isBlank(state) && isBlank(zip)) {
            return canonicalize(street);
        }
        String normStreet = isBlank(street) ? null : normalizeStreet(street);
        String normCity = isBlank(city) ? null : city.trim().toUpperCase(Locale.ROOT);
        String normState = isBlank(state) ? null : normalizeState(state);
        String normZip = isBlank(zip) ? null : normalizeZip(zip);
        return build(normStreet, normCity, normState, normZip);
    }

    /**
     * Returns the normalized form only, or null.
     */
    public String canonicalValue(String address) {
        NormalizedAddress parsed = canonicalize(address);
        return parsed != null && !parsed.isEmpty() ? parsed.normalized() : null;
    }

    public boolean addressesMatch(String address1, String address2) {
        return addressesMatch(address1, address2, DEFAULT_MATCH_THRESHOLD);
    }

    /**
     * Two addresses match when their normalized forms are equal, or when their ZIP codes do
     * not conflict and their streets score at least {@code threshold}.
     */
    public boolean addressesMatch(String address1, String address2, double threshold) {
        NormalizedAddress a = canonicalize(address1);
        NormalizedAddress b = canonicalize(address2);
        if (a == null || b == null) {
            return false;
        }
        if (a.normalized().equals(b.normalized())) {
            return true;
        }
        if (a.zip() != null && b.zip() != null && !a.zip().equals(b.zip())) {
            return false;
        }
        if (a.street() != null && b.street() != null) {
            return streetSimilarity.compute(a.street(), b.street()) >= threshold;
        }
        return false;
    }

    String normalizeStreet(String street) {
        String upper = WHITESPACE.matcher(street.trim().toUpperCase(Locale.ROOT)).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String word : upper.split(" ")) {
            String mapped = DefaultNormalizationRules.STREET_TYPES.getOrDefault(word, word);
            mapped = DefaultNormalizationRules.DIRECTIONS.getOrDefault(mapped, mapped);
            mapped = DefaultNormalizationRules.UNIT_TYPES.getOrDefault(mapped, mapped);
            words.add(mapped);
        }
        // PO BOX before period removal so that P.O. is still recognizable
        String joined = PO_BOX.matcher(String.join(" ", words)).replaceAll("PO BOX");
        return joined.replace(".", "");
    }

    String normalizeState(String state) {
        String upper = state.trim().toUpperCase(Locale.ROOT);
        if (upper.length() == 2) {
            return upper;
        }
        String known = DefaultNormalizationRules.STATE_NAMES.get(upper);
        if (known != null) {
            return known;
        }
        return upper.length() > 2 ? upper.substring(0, 2) : upper;
    }

    String normalizeZip(String zip) {
        String digits = NON_DIGIT.matcher(zip).replaceAll("");
        return digits.length() >= 5 ? digits.substring(0, 5) : digits;
    }

    private NormalizedAddress parseFull(String address) {
        String rest = WHITESPACE.matcher(address.trim().toUpperCase(Locale.ROOT)).replaceAll(" ");
        String zip = null;
        String state = null;
        String city = null;
        String street;

        Matcher zipMatcher = TRAILING_ZIP.matcher(rest);
        if (zipMatcher.find()) {
            zip = zipMatcher.group(1);
            rest = rest.substring(0, zipMatcher.start()).trim();
        }

        // Without a ZIP, a trailing two-letter token is a state only after a comma ("MAIN ST" is a street)
        Matcher stateMatcher = TRAILING_STATE.matcher(rest);
        if (stateMatcher.find()
                && (zip != null || rest.substring(0, stateMatcher.start()).trim().endsWith(","))) {
            state = stateMatcher.group(1);
            rest = rest.substring(0, stateMatcher.start()).trim();
        }

        while (rest.endsWith(",")) {
            rest = rest.substring(0, rest.length() - 1).trim();
        }

        int comma = rest.lastIndexOf(',');
        if (comma >= 0) {
            street = rest.substring(0, comma).trim();
            city = rest.substring(comma + 1).trim();
        } else {
            street = rest;
        }

        String normStreet = street.isEmpty() ? null : normalizeStreet(street);
        return build(normStreet, city == null || city.isEmpty() ? null : city, state, zip);
    }

    private static NormalizedAddress build(String street, String city, String state, String zip) {
        List<String> parts = new ArrayList<>(4);
        for (String part : new String[]{street, city, state, zip}) {
            if (part != null && !part.isEmpty()) {
                parts.add(part);
            }
        }
        return new NormalizedAddress(street, city, state, zip, String.join(" ", parts));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
