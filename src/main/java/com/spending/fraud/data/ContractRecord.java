package com.spending.fraud.data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A contract award between a vendor and an agency. {@code maxValue} is the ceiling the
 * agency may pay under the contract, when the source publishes one.
 */
public record ContractRecord(
        long id,
        String contractNumber,
        long vendorId,
        long agencyId,
        BigDecimal value,
        LocalDate startDate,
        String description,
        BigDecimal maxValue
) {
    public ContractRecord {
        Objects.requireNonNull(value, "value is required");
    }

    public ContractRecord(long id, String contractNumber, long vendorId, long agencyId, BigDecimal value,
                          LocalDate startDate, String description) {
        this(id, contractNumber, vendorId, agencyId, value, startDate, description, null);
    }

    public boolean hasMaxValue() {
        return maxValue != null && maxValue.signum() > 0;
    }
}
