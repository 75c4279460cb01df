package com.spending.fraud.detection;

import com.spending.fraud.detection.rules.ConfidentialityRule;
import com.spending.fraud.detection.rules.ContractSplittingRule;
import com.spending.fraud.detection.rules.CrossReferenceRule;
import com.spending.fraud.detection.rules.DebarmentRule;
import com.spending.fraud.detection.rules.DuplicatePaymentRule;
import com.spending.fraud.detection.rules.EmployeeVendorRule;
import com.spending.fraud.detection.rules.FiscalYearRushRule;
import com.spending.fraud.detection.rules.GhostVendorRule;
import com.spending.fraud.detection.rules.NetworkAnalysisRule;
import com.spending.fraud.detection.rules.PaymentAnomalyRule;
import com.spending.fraud.detection.rules.RelatedPartyRule;
import com.spending.fraud.detection.rules.VendorClusteringRule;
import com.spending.fraud.exception.EntityNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Named rules in run order, with command-line style aliases.
 */
public final class RuleRegistry {

    private final Map<String, DetectionRule> rules = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    /**
     * The built-in rules and their aliases. Duplicate payment detection runs after vendor
     * clustering so it sees the shared-address links clustering records.
     */
    public static RuleRegistry defaults() {
        return new RuleRegistry()
                .register(new ContractSplittingRule())
                .register(new VendorClusteringRule())
                .register(new DuplicatePaymentRule())
                .register(new PaymentAnomalyRule())
                .register(new ConfidentialityRule())
                .register(new NetworkAnalysisRule())
                .register(new CrossReferenceRule())
                .register(new EmployeeVendorRule())
                .register(new GhostVendorRule())
                .register(new FiscalYearRushRule())
                .register(new RelatedPartyRule())
                .register(new DebarmentRule())
                .alias("contract-splitting", ContractSplittingRule.NAME)
                .alias("vendor-clustering", VendorClusteringRule.NAME)
                .alias("duplicate-payments", DuplicatePaymentRule.NAME)
                .alias("payment-anomalies", PaymentAnomalyRule.NAME)
                .alias("network-analysis", NetworkAnalysisRule.NAME)
                .alias("address-clusters", CrossReferenceRule.NAME)
                .alias("pay-to-play", CrossReferenceRule.NAME)
                .alias("employee-vendor", EmployeeVendorRule.NAME)
                .alias("ghost-vendors", GhostVendorRule.NAME)
                .alias("fiscal-year-rush", FiscalYearRushRule.NAME)
                .alias("related-party", RelatedPartyRule.NAME)
                .alias("sam-exclusions", DebarmentRule.NAME);
    }

    public RuleRegistry register(DetectionRule rule) {
        if (rules.containsKey(rule.name())) {
            throw new IllegalArgumentException("Rule already registered: " + rule.name());
        }
        rules.put(rule.name(), rule);
        return this;
    }

    public RuleRegistry alias(String alias, String ruleName) {
        if (!rules.containsKey(ruleName)) {
            throw new IllegalArgumentException("Cannot alias unknown rule: " + ruleName);
        }
        aliases.put(alias.toLowerCase(Locale.ROOT), ruleName);
        return this;
    }

    /**
     * Looks up a rule by name or alias, ignoring case.
     *
     * @throws EntityNotFoundException if nothing matches
     */
    public DetectionRule resolve(String nameOrAlias) {
        if (nameOrAlias == null || nameOrAlias.isBlank()) {
            throw new EntityNotFoundException("Rule name is required");
        }
        String key = nameOrAlias.trim().toLowerCase(Locale.ROOT);
        DetectionRule rule = rules.get(key);
        if (rule == null && aliases.containsKey(key)) {
            rule = rules.get(aliases.get(key));
        }
        if (rule == null) {
            throw new EntityNotFoundException("Unknown rule: " + nameOrAlias + ". Available: " + rules.keySet());
        }
        return rule;
    }

    public List<DetectionRule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public Map<String, String> aliases() {
        return Collections.unmodifiableMap(aliases);
    }
}
