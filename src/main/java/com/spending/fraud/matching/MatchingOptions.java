package com.spending.fraud.matching;

/**
 * Options for a matching run: score threshold, per-item candidate cap, batch size,
 * worker count and blocking bucket cap.
 */
public class MatchingOptions {

    private static final double DEFAULT_THRESHOLD = 0.85;
    private static final int DEFAULT_MAX_CANDIDATES_PER_ITEM = 5;
    private static final int DEFAULT_BATCH_SIZE = 1_000;
    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final int DEFAULT_MAX_BLOCK_SIZE = 5_000;

    private final double threshold;
    private final int maxCandidatesPerItem;
    private final int batchSize;
    private final int maxWorkers;
    private final int maxBlockSize;

    private MatchingOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.maxCandidatesPerItem = builder.maxCandidatesPerItem;
        this.batchSize = builder.batchSize;
        this.maxWorkers = builder.maxWorkers;
        this.maxBlockSize = builder.maxBlockSize;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMaxCandidatesPerItem() {
        return maxCandidatesPerItem;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Blocking buckets holding more index entities than this are skipped for that key.
     */
    public int getMaxBlockSize() {
        return maxBlockSize;
    }

    /**
     * Copy of these options with a different threshold.
     */
    public MatchingOptions withThreshold(double newThreshold) {
        return toBuilder().threshold(newThreshold).build();
    }

    public Builder toBuilder() {
        return builder()
                .threshold(threshold)
                .maxCandidatesPerItem(maxCandidatesPerItem)
                .batchSize(batchSize)
                .maxWorkers(maxWorkers)
                .maxBlockSize(maxBlockSize);
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatchingOptions{threshold=" + threshold
                + ", maxCandidatesPerItem=" + maxCandidatesPerItem
                + ", batchSize=" + batchSize
                + ", maxWorkers=" + maxWorkers
                + ", maxBlockSize=" + maxBlockSize + '}';
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int maxCandidatesPerItem = DEFAULT_MAX_CANDIDATES_PER_ITEM;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;

        public Builder threshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder maxCandidatesPerItem(int maxCandidatesPerItem) {
            this.maxCandidatesPerItem = positive(maxCandidatesPerItem, "maxCandidatesPerItem");
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = positive(batchSize, "batchSize");
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = positive(maxWorkers, "maxWorkers");
            return this;
        }

        public Builder maxBlockSize(int maxBlockSize) {
            this.maxBlockSize = positive(maxBlockSize, "maxBlockSize");
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private static int positive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
