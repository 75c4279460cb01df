package com.spending.fraud.data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single payment from an agency to a vendor. Confidential payments are those the source
 * system flags as withheld from public detail.
 */
public record PaymentRecord(
        long id,
        long vendorId,
        long agencyId,
        BigDecimal amount,
        LocalDate paymentDate,
        boolean confidential,
        String description
) {
    public PaymentRecord {
        Objects.requireNonNull(amount, "amount is required");
        Objects.requireNonNull(paymentDate, "paymentDate is required");
    }

    public PaymentRecord(long id, long vendorId, long agencyId, BigDecimal amount, LocalDate paymentDate) {
        this(id, vendorId, agencyId, amount, paymentDate, false, null);
    }
}
