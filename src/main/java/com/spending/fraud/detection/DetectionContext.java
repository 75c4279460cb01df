package com.spending.fraud.detection;

import com.spending.fraud.alert.AlertEngine;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.config.DetectionThresholds;
import com.spending.fraud.config.EngineConfig;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.data.SpendingDataSource;
import com.spending.fraud.graph.BipartiteGraph;
import com.spending.fraud.graph.GraphBuilder;
import com.spending.fraud.graph.PaymentAggregate;
import com.spending.fraud.matching.MatchingEngine;
import com.spending.fraud.matching.MatchingOptions;
import com.spending.fraud.matching.RelationshipMatcher;
import com.spending.fraud.normalization.AddressCanonicalizer;
import com.spending.fraud.normalization.NameCanonicalizer;
import com.spending.fraud.similarity.IndelSimilarity;
import com.spending.fraud.store.InMemoryRelationshipStore;
import com.spending.fraud.store.RelationshipStore;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a rule needs during a run. The transaction graph and the per-vendor payment
 * totals are built on first use and then shared by all rules of the same run; call
 * {@link #forNewRun()} to get a context with fresh snapshots.
 */
public final class DetectionContext {

    private final DetectionThresholds thresholds;
    private final SpendingDataSource dataSource;
    private final RelationshipStore store;
    private final AlertEngine alertEngine;
    private final MatchingEngine matchingEngine;
    private final MatchingOptions matchingOptions;
    private final NameCanonicalizer nameCanonicalizer;
    private final AddressCanonicalizer addressCanonicalizer;
    private final Clock clock;

    private volatile BipartiteGraph graph;
    private volatile VendorTotals vendorTotals;

    private record VendorTotals(Map<Long, Double> amounts, Map<Long, Long> counts) {
    }

    private DetectionContext(Builder builder) {
        this.thresholds = builder.thresholds;
        this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource is required");
        this.store = builder.store;
        this.alertEngine = Objects.requireNonNull(builder.alertEngine, "alertEngine is required");
        this.matchingEngine = builder.matchingEngine;
        this.matchingOptions = builder.matchingOptions;
        this.nameCanonicalizer = builder.nameCanonicalizer;
        this.addressCanonicalizer = builder.addressCanonicalizer;
        this.clock = builder.clock;
    }

    /**
     * A context with the same collaborators and no cached snapshots.
     */
    public DetectionContext forNewRun() {
        return toBuilder().build();
    }

    public DetectionThresholds thresholds() {
        return thresholds;
    }

    public SpendingDataSource data() {
        return dataSource;
    }

    public RelationshipStore store() {
        return store;
    }

    public RelationshipMatcher relationshipMatcher() {
        return new RelationshipMatcher(store);
    }

    public AlertEngine alerts() {
        return alertEngine;
    }

    /**
     * Shortcut for rules: creates the alert and returns 1 when it was inserted, 0 for a duplicate.
     */
    public int raise(AlertRequest request) {
        return alertEngine.createAlert(request).created() ? 1 : 0;
    }

    public MatchingEngine matchingEngine() {
        return matchingEngine;
    }

    public MatchingOptions matchingOptions() {
        return matchingOptions;
    }

    /**
     * Matching options with the threshold replaced.
     */
    public MatchingOptions matchingOptions(double threshold) {
        return matchingOptions.withThreshold(threshold);
    }

    public NameCanonicalizer names() {
        return nameCanonicalizer;
    }

    public AddressCanonicalizer addresses() {
        return addressCanonicalizer;
    }

    public Clock clock() {
        return clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Vendor/agency graph with the vendor-vendor relationships present in the store when
     * first requested. Immutable once built.
     */
    public BipartiteGraph graph() {
        BipartiteGraph result = graph;
        if (result == null) {
            synchronized (this) {
                result = graph;
                if (result == null) {
                    result = GraphBuilder.build(dataSource.paymentAggregates(),
                            store.queryBetween(EntityKind.VENDOR, EntityKind.VENDOR));
                    graph = result;
                }
            }
        }
        return result;
    }

    /**
     * Total payments per vendor id over all agencies.
     */
    public Map<Long, Double> vendorPaymentTotals() {
        return vendorTotals().amounts();
    }

    public double vendorPaymentTotal(long vendorId) {
        return vendorTotals().amounts().getOrDefault(vendorId, 0.0);
    }

    public long vendorPaymentCount(long vendorId) {
        return vendorTotals().counts().getOrDefault(vendorId, 0L);
    }

    private VendorTotals vendorTotals() {
        VendorTotals result = vendorTotals;
        if (result == null) {
            synchronized (this) {
                result = vendorTotals;
                if (result == null) {
                    Map<Long, Double> amounts = new HashMap<>();
                    Map<Long, Long> counts = new HashMap<>();
                    for (PaymentAggregate aggregate : dataSource.paymentAggregates()) {
                        amounts.merge(aggregate.vendorId(), aggregate.paymentTotal(), Double::sum);
                        counts.merge(aggregate.vendorId(), aggregate.paymentCount(), Long::sum);
                    }
                    result = new VendorTotals(Collections.unmodifiableMap(amounts), Collections.unmodifiableMap(counts));
                    vendorTotals = result;
                }
            }
        }
        return result;
    }

    public Builder toBuilder() {
        return new Builder()
                .thresholds(thresholds)
                .dataSource(dataSource)
                .store(store)
                .alertEngine(alertEngine)
                .matchingEngine(matchingEngine)
                .matchingOptions(matchingOptions)
                .nameCanonicalizer(nameCanonicalizer)
                .addressCanonicalizer(addressCanonicalizer)
                .clock(clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DetectionThresholds thresholds = DetectionThresholds.empty();
        private SpendingDataSource dataSource;
        private RelationshipStore store = new InMemoryRelationshipStore();
        private AlertEngine alertEngine;
        private MatchingEngine matchingEngine = new MatchingEngine();
        private MatchingOptions matchingOptions = MatchingOptions.defaults();
        private NameCanonicalizer nameCanonicalizer = new NameCanonicalizer();
        private AddressCanonicalizer addressCanonicalizer = new AddressCanonicalizer();
        private Clock clock = Clock.systemDefaultZone();

        /**
         * Applies thresholds, matching options and the canonicalization cache settings.
         */
        public Builder config(EngineConfig config) {
            this.thresholds = config.thresholds();
            this.matchingOptions = config.matching();
            this.nameCanonicalizer = new NameCanonicalizer(config.cache());
            this.addressCanonicalizer = new AddressCanonicalizer(new IndelSimilarity(), config.cache());
            return this;
        }

        public Builder thresholds(DetectionThresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds);
            return this;
        }

        public Builder dataSource(SpendingDataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder store(RelationshipStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder alertEngine(AlertEngine alertEngine) {
            this.alertEngine = alertEngine;
            return this;
        }

        public Builder matchingEngine(MatchingEngine matchingEngine) {
            this.matchingEngine = Objects.requireNonNull(matchingEngine);
            return this;
        }

        public Builder matchingOptions(MatchingOptions matchingOptions) {
            this.matchingOptions = Objects.requireNonNull(matchingOptions);
            return this;
        }

        public Builder nameCanonicalizer(NameCanonicalizer nameCanonicalizer) {
            this.nameCanonicalizer = Objects.requireNonNull(nameCanonicalizer);
            return this;
        }

        public Builder addressCanonicalizer(AddressCanonicalizer addressCanonicalizer) {
            this.addressCanonicalizer = Objects.requireNonNull(addressCanonicalizer);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public DetectionContext build() {
            return new DetectionContext(this);
        }
    }
}
