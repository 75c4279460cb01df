package com.spending.fraud.graph;

import java.util.function.ToDoubleFunction;

/**
 * Which aggregate figure is used as an edge weight.
 */
public enum WeightMetric {
    PAYMENT_TOTAL(PaymentAggregate::paymentTotal),
    PAYMENT_COUNT(a -> a.paymentCount()),
    CONTRACT_TOTAL(PaymentAggregate::contractTotal),
    CONTRACT_COUNT(a -> a.contractCount()),
    TOTAL_VALUE(a -> a.paymentTotal() + a.contractTotal());

    private final ToDoubleFunction<PaymentAggregate> extractor;

    WeightMetric(ToDoubleFunction<PaymentAggregate> extractor) {
        this.extractor = extractor;
    }

    public double weight(PaymentAggregate aggregate) {
        return extractor.applyAsDouble(aggregate);
    }
}
