package com.spending.fraud.metrics;

import com.spending.fraud.detection.TaskStatus;
import com.spending.fraud.store.UpsertResult;

import java.time.Duration;

/**
 * Records engine metrics. The default {@link NoOpMetricsService} does nothing, so the
 * engine works without Micrometer on the classpath.
 */
public interface MetricsService {

    void recordMatchingBatch(Duration duration, boolean failed);

    void incrementCandidatePairs(int count);

    void incrementSkippedEntities(int count);

    void incrementOversizedBlocks(int count);

    void recordRuleDuration(String ruleName, TaskStatus status, Duration duration);

    void incrementAlertCreated(String alertType);

    void incrementAlertSuppressed(String alertType);

    void incrementRelationshipUpsert(UpsertResult result);
}
