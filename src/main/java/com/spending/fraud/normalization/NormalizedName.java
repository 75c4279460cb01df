package com.spending.fraud.normalization;

import java.util.Objects;
import java.util.Set;

/**
 * Canonical form of a name together with its blocking keys.
 */
public record NormalizedName(String value, Set<String> blockingKeys) {

    public NormalizedName {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Normalized name must not be blank");
        }
        blockingKeys = blockingKeys != null ? Set.copyOf(blockingKeys) : Set.of();
    }

    /**
     * Returns true if the two names share at least one blocking key.
     */
    public boolean sharesBlockWith(NormalizedName other) {
        for (String key : blockingKeys) {
            if (other.blockingKeys.contains(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return value;
    }
}
