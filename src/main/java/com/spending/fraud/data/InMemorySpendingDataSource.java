package com.spending.fraud.data;

import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.graph.PaymentAggregate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory spending dataset. Payment aggregates are derived from the payments and
 * contracts added, unless explicit aggregates are supplied.
 */
public class InMemorySpendingDataSource implements SpendingDataSource {

    private final List<CanonicalEntity> entities;
    private final List<ContractRecord> contracts;
    private final List<PaymentRecord> payments;
    private final List<ContributionRecord> contributions;
    private final List<PaymentAggregate> explicitAggregates;

    private InMemorySpendingDataSource(Builder builder) {
        this.entities = List.copyOf(builder.entities);
        this.contracts = List.copyOf(builder.contracts);
        this.payments = List.copyOf(builder.payments);
        this.contributions = List.copyOf(builder.contributions);
        this.explicitAggregates = builder.aggregates.isEmpty() ? null : List.copyOf(builder.aggregates);
    }

    @Override
    public List<CanonicalEntity> vendors() {
        return ofKind(EntityKind.VENDOR);
    }

    @Override
    public List<CanonicalEntity> employees() {
        return ofKind(EntityKind.EMPLOYEE);
    }

    @Override
    public List<CanonicalEntity> contributors() {
        return ofKind(EntityKind.CONTRIBUTOR);
    }

    @Override
    public List<CanonicalEntity> agencies() {
        return ofKind(EntityKind.AGENCY);
    }

    @Override
    public List<CanonicalEntity> debarredEntities() {
        return ofKind(EntityKind.DEBARRED);
    }

    @Override
    public List<CanonicalEntity> taxPermitHolders() {
        return ofKind(EntityKind.TAX_PERMIT);
    }

    @Override
    public List<PaymentAggregate> paymentAggregates() {
        if (explicitAggregates != null) {
            return explicitAggregates;
        }
        Map<String, PaymentAggregate> totals = new LinkedHashMap<>();
        for (PaymentRecord p : payments) {
            PaymentAggregate a = PaymentAggregate.payments(p.vendorId(), p.agencyId(), p.amount().doubleValue(), 1);
            totals.merge(p.vendorId() + ":" + p.agencyId(), a, PaymentAggregate::plus);
        }
        for (ContractRecord c : contracts) {
            PaymentAggregate a = new PaymentAggregate(c.vendorId(), c.agencyId(), 0.0, 0, c.value().doubleValue(), 1);
            totals.merge(c.vendorId() + ":" + c.agencyId(), a, PaymentAggregate::plus);
        }
        return List.copyOf(totals.values());
    }

    @Override
    public List<ContractRecord> contracts() {
        return contracts;
    }

    @Override
    public List<PaymentRecord> payments(LocalDate from, LocalDate to) {
        return payments.stream()
                .filter(p -> !p.paymentDate().isBefore(from) && !p.paymentDate().isAfter(to))
                .toList();
    }

    @Override
    public List<ContributionRecord> contributions() {
        return contributions;
    }

    private List<CanonicalEntity> ofKind(EntityKind kind) {
        return entities.stream().filter(e -> e.getKind() == kind).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<CanonicalEntity> entities = new ArrayList<>();
        private final List<ContractRecord> contracts = new ArrayList<>();
        private final List<PaymentRecord> payments = new ArrayList<>();
        private final List<ContributionRecord> contributions = new ArrayList<>();
        private final List<PaymentAggregate> aggregates = new ArrayList<>();
        private long nextRecordId = 1;

        public Builder entity(CanonicalEntity entity) {
            entities.add(entity);
            return this;
        }

        public Builder entities(List<CanonicalEntity> list) {
            entities.addAll(list);
            return this;
        }

        public Builder contract(ContractRecord contract) {
            contracts.add(contract);
            return this;
        }

        public Builder contract(long vendorId, long agencyId, String value, LocalDate startDate) {
            long id = nextRecordId++;
            return contract(new ContractRecord(id, "C-" + id, vendorId, agencyId, new BigDecimal(value), startDate, null));
        }

        public Builder payment(PaymentRecord payment) {
            payments.add(payment);
            return this;
        }

        public Builder payment(long vendorId, long agencyId, String amount, LocalDate date) {
            return payment(new PaymentRecord(nextRecordId++, vendorId, agencyId, new BigDecimal(amount), date));
        }

        public Builder confidentialPayment(long vendorId, long agencyId, String amount, LocalDate date) {
            return payment(new PaymentRecord(nextRecordId++, vendorId, agencyId, new BigDecimal(amount), date,
                    true, null));
        }

        /**
         * Adds a contract with a published ceiling.
         */
        public Builder contract(long vendorId, long agencyId, String value, String maxValue, LocalDate startDate) {
            long id = nextRecordId++;
            return contract(new ContractRecord(id, "C-" + id, vendorId, agencyId, new BigDecimal(value), startDate,
                    null, new BigDecimal(maxValue)));
        }

        public Builder contribution(ContributionRecord contribution) {
            contributions.add(contribution);
            return this;
        }

        /**
         * Supplies aggregates directly; derived aggregates are then not computed.
         */
        public Builder aggregate(PaymentAggregate aggregate) {
            aggregates.add(aggregate);
            return this;
        }

        public InMemorySpendingDataSource build() {
            return new InMemorySpendingDataSource(this);
        }
    }
}
