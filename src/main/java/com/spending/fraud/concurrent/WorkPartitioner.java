package com.spending.fraud.concurrent;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a list of work items into contiguous, order-preserving batches.
 */
public final class WorkPartitioner {

    private WorkPartitioner() {
    }

    /**
     * Partitions the items into batches of at most {@code batchSize} elements. Concatenating
     * the batches yields the original list; only the last batch may be short.
     *
     * @throws IllegalArgumentException if batchSize is not positive
     */
    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        List<List<T>> batches = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            batches.add(List.copyOf(items.subList(start, end)));
        }
        return batches;
    }
}
