package com.spending.fraud.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named detection thresholds. Rules read values with a default; a missing key or a value
 * that is not a number yields the default instead of failing the rule.
 */
public final class DetectionThresholds {
    private static final Logger log = LoggerFactory.getLogger(DetectionThresholds.class);

    private static final DetectionThresholds EMPTY = new DetectionThresholds(Map.of());

    private final Map<String, Object> values;

    public DetectionThresholds(Map<String, ?> values) {
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static DetectionThresholds empty() {
        return EMPTY;
    }

    public double getDouble(String key, double defaultValue) {
        BigDecimal value = numeric(key);
        return value != null ? value.doubleValue() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        BigDecimal value = numeric(key);
        return value != null ? value.intValue() : defaultValue;
    }

    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        BigDecimal value = numeric(key);
        return value != null ? value : defaultValue;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns a copy with the given value set, leaving this instance unchanged.
     */
    public DetectionThresholds with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new DetectionThresholds(copy);
    }

    private BigDecimal numeric(String key) {
        Object raw = values.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("threshold.malformed key={} value='{}', using default", key, raw);
            return null;
        }
    }

    @Override
    public String toString() {
        return "DetectionThresholds" + values;
    }
}
