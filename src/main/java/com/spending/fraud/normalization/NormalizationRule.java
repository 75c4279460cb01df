package com.spending.fraud.normalization;

import com.spending.fraud.core.model.EntityKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One regex rewrite applied to an uppercased name. An empty {@code kinds} set makes the rule
 * apply to every kind, including names canonicalized without a kind.
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<EntityKind> kinds, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
    }

    public static NormalizationRule global(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement,
                Set.of(), priority);
    }

    public static NormalizationRule forKinds(String name, String regex, String replacement, int priority,
                                             EntityKind first, EntityKind... rest) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement,
                EnumSet.of(first, rest), priority);
    }

    /**
     * Kind-scoped rules never apply to a name without a kind.
     */
    public boolean appliesTo(EntityKind kind) {
        if (kinds.isEmpty()) {
            return true;
        }
        return kind != null && kinds.contains(kind);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
