package com.spending.fraud.normalization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default blocking key strategy using three complementary keys over the name core
 * (the name without standardized business suffix tokens):
 * <ul>
 *   <li><b>Prefix key</b>: first 3 characters of the core, spaces removed (e.g. {@code pfx:ACM})</li>
 *   <li><b>Token key</b>: first core token (e.g. {@code tok:ACME})</li>
 *   <li><b>Suffix key</b>: last 4 characters of the core, spaces removed (e.g. {@code sfx:PPLY})</li>
 * </ul>
 *
 * <p>Recall trade-off: two names are never compared when they differ in the first three
 * characters, in the first token and in the last four characters of their cores. Typos
 * confined to either end of a name still meet through the opposite key.</p>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int DEFAULT_PREFIX_LENGTH = 3;
    private static final int DEFAULT_SUFFIX_LENGTH = 4;

    private final int prefixLength;
    private final int suffixLength;
    private final Set<String> ignoredTokens;

    public DefaultBlockingKeyStrategy() {
        this(DEFAULT_PREFIX_LENGTH, DEFAULT_SUFFIX_LENGTH, DefaultNormalizationRules.BUSINESS_SUFFIXES);
    }

    public DefaultBlockingKeyStrategy(int prefixLength, int suffixLength, Set<String> ignoredTokens) {
        if (prefixLength <= 0 || suffixLength <= 0) {
            throw new IllegalArgumentException("Key lengths must be > 0");
        }
        this.prefixLength = prefixLength;
        this.suffixLength = suffixLength;
        this.ignoredTokens = Set.copyOf(ignoredTokens);
    }

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }

        String[] tokens = normalizedName.toUpperCase(Locale.ROOT).trim().split("\\s+");
        List<String> core = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            if (!ignoredTokens.contains(token)) {
                core.add(token);
            }
        }
        // A name made only of suffix tokens keeps them all
        if (core.isEmpty()) {
            core = List.of(tokens);
        }

        String joined = String.join("", core);
        keys.add("pfx:" + joined.substring(0, Math.min(prefixLength, joined.length())));
        keys.add("tok:" + core.get(0));
        keys.add("sfx:" + joined.substring(Math.max(0, joined.length() - suffixLength)));
        return keys;
    }
}
