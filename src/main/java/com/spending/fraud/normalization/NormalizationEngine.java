package com.spending.fraud.normalization;

import com.spending.fraud.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies regex normalization rules to names in priority order
 * (lower priority number = higher precedence).
 *
 * <p>The rule list is fixed at construction so an engine can be shared between
 * matching workers.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Uppercases the name, then applies every rule applicable to the kind.
     * A null kind applies the rules that are not kind-scoped.
     */
    public String apply(String name, EntityKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.toUpperCase(Locale.ROOT).trim().replaceAll("\\s+", " ");

        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(kind)) {
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }
}
