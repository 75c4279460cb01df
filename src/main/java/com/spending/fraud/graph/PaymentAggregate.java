package com.spending.fraud.graph;

/**
 * Aggregate transaction totals between one vendor and one agency.
 */
public record PaymentAggregate(
        long vendorId,
        long agencyId,
        double paymentTotal,
        long paymentCount,
        double contractTotal,
        long contractCount
) {
    public PaymentAggregate {
        if (paymentCount < 0 || contractCount < 0) {
            throw new IllegalArgumentException("Counts must be >= 0");
        }
    }

    public static PaymentAggregate payments(long vendorId, long agencyId, double total, long count) {
        return new PaymentAggregate(vendorId, agencyId, total, count, 0.0, 0);
    }

    /**
     * Sum of two aggregates for the same vendor and agency.
     */
    public PaymentAggregate plus(PaymentAggregate other) {
        if (other.vendorId != vendorId || other.agencyId != agencyId) {
            throw new IllegalArgumentException("Cannot add aggregates for different pairs");
        }
        return new PaymentAggregate(vendorId, agencyId,
                paymentTotal + other.paymentTotal, paymentCount + other.paymentCount,
                contractTotal + other.contractTotal, contractCount + other.contractCount);
    }

    public NodeId vendor() {
        return NodeId.vendor(vendorId);
    }

    public NodeId agency() {
        return NodeId.agency(agencyId);
    }
}
