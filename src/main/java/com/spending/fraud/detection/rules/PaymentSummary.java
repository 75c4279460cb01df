package com.spending.fraud.detection.rules;

import com.spending.fraud.data.PaymentRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToLongFunction;

/**
 * Running payment totals for one vendor or agency.
 */
final class PaymentSummary {
    BigDecimal total = BigDecimal.ZERO;
    BigDecimal confidentialTotal = BigDecimal.ZERO;
    int count;
    int confidentialCount;
    final Set<Long> agencies = new TreeSet<>();
    LocalDate first;
    LocalDate last;

    void add(PaymentRecord payment) {
        total = total.add(payment.amount());
        count++;
        if (payment.confidential()) {
            confidentialTotal = confidentialTotal.add(payment.amount());
            confidentialCount++;
        }
        agencies.add(payment.agencyId());
        LocalDate date = payment.paymentDate();
        if (first == null || date.isBefore(first)) {
            first = date;
        }
        if (last == null || date.isAfter(last)) {
            last = date;
        }
    }

    double totalAmount() {
        return total.doubleValue();
    }

    double confidentialRate() {
        return count == 0 ? 0.0 : (double) confidentialCount / count;
    }

    static Map<Long, PaymentSummary> byVendor(Collection<PaymentRecord> payments) {
        return group(payments, PaymentRecord::vendorId);
    }

    static Map<Long, PaymentSummary> byAgency(Collection<PaymentRecord> payments) {
        return group(payments, PaymentRecord::agencyId);
    }

    private static Map<Long, PaymentSummary> group(Collection<PaymentRecord> payments, ToLongFunction<PaymentRecord> key) {
        Map<Long, PaymentSummary> summaries = new TreeMap<>();
        for (PaymentRecord payment : payments) {
            summaries.computeIfAbsent(key.applyAsLong(payment), k -> new PaymentSummary()).add(payment);
        }
        return summaries;
    }
}
