package com.spending.fraud.detection.rules;

import com.spending.fraud.core.model.CanonicalEntity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Small helpers shared by the built-in rules.
 */
final class RuleSupport {

    private RuleSupport() {
    }

    static Map<Long, CanonicalEntity> byId(Collection<CanonicalEntity> entities) {
        Map<Long, CanonicalEntity> index = new HashMap<>();
        for (CanonicalEntity entity : entities) {
            index.put(entity.getId(), entity);
        }
        return index;
    }

    static String nameOf(Map<Long, CanonicalEntity> index, long id, String fallback) {
        CanonicalEntity entity = index.get(id);
        return entity != null ? entity.label() : fallback;
    }

    static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    static String wholeMoney(double amount) {
        return String.format(Locale.US, "$%,.0f", amount);
    }

    static String percent(double fraction) {
        return String.format(Locale.US, "%.0f%%", fraction * 100.0);
    }

    static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0.0 : sum / values.size();
    }

    static double populationStddev(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / values.size());
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return null;
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
