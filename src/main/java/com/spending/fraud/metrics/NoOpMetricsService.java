package com.spending.fraud.metrics;

import com.spending.fraud.detection.TaskStatus;
import com.spending.fraud.store.UpsertResult;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchingBatch(Duration duration, boolean failed) {
    }

    @Override
    public void incrementCandidatePairs(int count) {
    }

    @Override
    public void incrementSkippedEntities(int count) {
    }

    @Override
    public void incrementOversizedBlocks(int count) {
    }

    @Override
    public void recordRuleDuration(String ruleName, TaskStatus status, Duration duration) {
    }

    @Override
    public void incrementAlertCreated(String alertType) {
    }

    @Override
    public void incrementAlertSuppressed(String alertType) {
    }

    @Override
    public void incrementRelationshipUpsert(UpsertResult result) {
    }
}
