package com.spending.fraud.core.model;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * An entity as supplied by ingestion: identity, display name and canonical keys.
 * Attributes such as cumulative payment volume are read-only inputs to severity scoring.
 */
public final class CanonicalEntity {

    public static final String ATTR_PAYMENT_TOTAL = "payment_total";
    public static final String ATTR_PAYMENT_COUNT = "payment_count";
    public static final String ATTR_ADDRESS = "address";
    public static final String ATTR_VENDOR_CODE = "vendor_code";
    public static final String ATTR_AGENCY_NAME = "agency_name";
    public static final String ATTR_JOB_TITLE = "job_title";
    public static final String ATTR_ANNUAL_SALARY = "annual_salary";
    public static final String ATTR_CITY = "city";
    public static final String ATTR_STATE = "state";
    public static final String ATTR_ZIP = "zip_code";
    public static final String ATTR_PHONE = "phone";
    public static final String ATTR_IN_CMBL = "in_cmbl";
    public static final String ATTR_FIRST_SEEN = "first_seen";

    private final long id;
    private final EntityKind kind;
    private final String displayName;
    private final String normalizedName;
    private final String normalizedAddress;
    private final Map<String, Object> attributes;

    private CanonicalEntity(Builder builder) {
        this.id = builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.displayName = builder.displayName;
        this.normalizedName = builder.normalizedName;
        this.normalizedAddress = builder.normalizedAddress;
        this.attributes = builder.attributes != null ? Map.copyOf(builder.attributes) : Map.of();
    }

    public long getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getNormalizedAddress() {
        return normalizedAddress;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public EntityRef ref() {
        return new EntityRef(kind, id);
    }

    public boolean hasNormalizedName() {
        return normalizedName != null && !normalizedName.isBlank();
    }

    public boolean hasNormalizedAddress() {
        return normalizedAddress != null && !normalizedAddress.isBlank();
    }

    /**
     * Reads a numeric attribute, returning the default when absent or not numeric.
     */
    public double numericAttribute(String name, double defaultValue) {
        Object value = attributes.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return defaultValue;
    }

    public String stringAttribute(String name) {
        Object value = attributes.get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Reads a flag stored as a boolean or as "true"/"false"; null when absent.
     */
    public Boolean booleanAttribute(String name) {
        Object value = attributes.get(name);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Reads a date stored as a {@link LocalDate} or an ISO-8601 string; null when absent.
     *
     * @throws java.time.format.DateTimeParseException if a string value is not an ISO date
     */
    public LocalDate dateAttribute(String name) {
        Object value = attributes.get(name);
        if (value == null || value instanceof LocalDate) {
            return (LocalDate) value;
        }
        return LocalDate.parse(value.toString().trim());
    }

    /**
     * Display name, falling back to the normalized name and then the reference.
     */
    public String label() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return normalizedName != null ? normalizedName : ref().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return id == that.id && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "ref=" + ref() +
                ", displayName='" + displayName + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private EntityKind kind;
        private String displayName;
        private String normalizedName;
        private String normalizedAddress;
        private Map<String, Object> attributes;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder normalizedAddress(String normalizedAddress) {
            this.normalizedAddress = normalizedAddress;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public CanonicalEntity build() {
            return new CanonicalEntity(this);
        }
    }
}
