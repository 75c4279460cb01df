package com.spending.fraud.data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A campaign contribution made by a contributor entity to a filer (candidate or committee).
 */
public record ContributionRecord(
        long id,
        long contributorId,
        BigDecimal amount,
        String filerName,
        LocalDate contributionDate
) {
    public ContributionRecord {
        Objects.requireNonNull(amount, "amount is required");
    }
}
