package com.spending.fraud.data;

import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.graph.PaymentAggregate;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only view of the spending dataset, provided by the ingestion layer and queried
 * fresh for each detection run. Entities are expected to carry their normalized names.
 */
public interface SpendingDataSource {

    List<CanonicalEntity> vendors();

    List<CanonicalEntity> employees();

    List<CanonicalEntity> contributors();

    List<CanonicalEntity> agencies();

    /**
     * Active exclusion list entries.
     */
    List<CanonicalEntity> debarredEntities();

    /**
     * Vendor by agency totals over all payments and contracts.
     */
    List<PaymentAggregate> paymentAggregates();

    List<ContractRecord> contracts();

    /**
     * Business names registered for state tax permits.
     */
    List<CanonicalEntity> taxPermitHolders();

    /**
     * Payments dated within {@code [from, to]}, both inclusive.
     */
    List<PaymentRecord> payments(LocalDate from, LocalDate to);

    default List<PaymentRecord> allPayments() {
        return payments(LocalDate.MIN, LocalDate.MAX);
    }

    List<ContributionRecord> contributions();
}
