package com.spending.fraud.matching;

import java.util.List;

/**
 * Output of a matching run.
 *
 * @param pairs           candidate pairs, sorted by first then second entity
 * @param skippedEntities entities without a usable normalized name
 * @param failedBatches   batches whose worker raised; their pairs are missing
 * @param oversizedBlocks blocking buckets skipped for exceeding the size cap
 * @param batchErrors     one message per failed batch
 */
public record MatchingResult(
        List<CandidatePair> pairs,
        int skippedEntities,
        int failedBatches,
        int oversizedBlocks,
        List<String> batchErrors
) {
    public MatchingResult {
        pairs = List.copyOf(pairs);
        batchErrors = List.copyOf(batchErrors);
    }

    public static MatchingResult empty(int skippedEntities) {
        return new MatchingResult(List.of(), skippedEntities, 0, 0, List.of());
    }

    public boolean isComplete() {
        return failedBatches == 0;
    }
}
