package com.spending.fraud.normalization;

import com.spending.fraud.cache.CacheConfig;
import com.spending.fraud.cache.CanonicalizationCache;
import com.spending.fraud.core.model.EntityKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw entity names into comparable canonical names.
 *
 * <p>Transformations, in order: uppercase and whitespace collapse, business suffix
 * standardization, person title removal (person kinds only), punctuation removal,
 * {@code &} to {@code AND}, abbreviation expansion, filler word removal for multi-word
 * names. The function is pure: the same input always yields the same output.</p>
 */
public class NameCanonicalizer {

    private final NormalizationEngine engine;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CanonicalizationCache<NormalizedName> cache;

    public NameCanonicalizer() {
        this(DefaultNormalizationRules.createDefaultEngine(), new DefaultBlockingKeyStrategy(), CacheConfig.disabled());
    }

    public NameCanonicalizer(CacheConfig cacheConfig) {
        this(DefaultNormalizationRules.createDefaultEngine(), new DefaultBlockingKeyStrategy(), cacheConfig);
    }

    public NameCanonicalizer(NormalizationEngine engine, BlockingKeyStrategy blockingKeyStrategy,
                             CacheConfig cacheConfig) {
        this.engine = engine;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.cache = CanonicalizationCache.create(cacheConfig);
    }

    public BlockingKeyStrategy getBlockingKeyStrategy() {
        return blockingKeyStrategy;
    }

    /**
     * Canonicalizes a business name.
     *
     * @return the canonical name, or null for null, blank or fully-stripped input
     */
    public NormalizedName canonicalize(String raw) {
        return canonicalize(raw, EntityKind.VENDOR);
    }

    /**
     * Canonicalizes a name using the rules applicable to the entity kind.
     *
     * @return the canonical name, or null for null, blank or fully-stripped input
     */
    public NormalizedName canonicalize(String raw, EntityKind kind) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return cache.get(kind.name() + '\u0000' + raw, key -> compute(raw, kind));
    }

    /**
     * Convenience accessor returning only the canonical string.
     */
    public String canonicalValue(String raw, EntityKind kind) {
        NormalizedName name = canonicalize(raw, kind);
        return name != null ? name.value() : null;
    }

    public CanonicalizationCache<NormalizedName> getCache() {
        return cache;
    }

    private NormalizedName compute(String raw, EntityKind kind) {
        String ruled = engine.apply(raw, kind);
        if (ruled.isEmpty()) {
            return null;
        }

        String[] tokens = ruled.split(" ");
        List<String> words = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            words.add(DefaultNormalizationRules.ABBREVIATIONS.getOrDefault(token, token));
        }
        if (words.size() > 1) {
            words.removeIf(DefaultNormalizationRules.FILLER_WORDS::contains);
        }

        String value = String.join(" ", words).trim();
        if (value.isEmpty()) {
            return null;
        }
        return new NormalizedName(value, blockingKeyStrategy.generateKeys(value));
    }
}
