package com.spending.fraud.metrics;

import com.spending.fraud.detection.TaskStatus;
import com.spending.fraud.store.UpsertResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fraud.matching.batch.duration}: Timer (tag: outcome)</li>
 *   <li>{@code fraud.matching.pairs}: Counter</li>
 *   <li>{@code fraud.matching.skipped}: Counter</li>
 *   <li>{@code fraud.matching.oversized.blocks}: Counter</li>
 *   <li>{@code fraud.rule.duration}: Timer (tags: rule, status)</li>
 *   <li>{@code fraud.alert.created}: Counter (tag: alertType)</li>
 *   <li>{@code fraud.alert.suppressed}: Counter (tag: alertType)</li>
 *   <li>{@code fraud.relationship.upsert}: Counter (tag: result)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter pairCounter;
    private final Counter skippedCounter;
    private final Counter oversizedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pairCounter = Counter.builder("fraud.matching.pairs")
                .description("Candidate pairs emitted by the matching engine")
                .register(registry);
        this.skippedCounter = Counter.builder("fraud.matching.skipped")
                .description("Entities skipped for lacking a normalized name")
                .register(registry);
        this.oversizedCounter = Counter.builder("fraud.matching.oversized.blocks")
                .description("Blocking buckets skipped for exceeding the block size limit")
                .register(registry);
    }

    @Override
    public void recordMatchingBatch(Duration duration, boolean failed) {
        String outcome = failed ? "failed" : "ok";
        timerCache.computeIfAbsent("batch:" + outcome, k ->
                Timer.builder("fraud.matching.batch.duration")
                        .description("Duration of matching batches")
                        .tag("outcome", outcome)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementCandidatePairs(int count) {
        pairCounter.increment(count);
    }

    @Override
    public void incrementSkippedEntities(int count) {
        skippedCounter.increment(count);
    }

    @Override
    public void incrementOversizedBlocks(int count) {
        oversizedCounter.increment(count);
    }

    @Override
    public void recordRuleDuration(String ruleName, TaskStatus status, Duration duration) {
        timerCache.computeIfAbsent("rule:" + ruleName + ":" + status.name(), k ->
                Timer.builder("fraud.rule.duration")
                        .description("Duration of detection rule executions")
                        .tag("rule", ruleName)
                        .tag("status", status.name())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementAlertCreated(String alertType) {
        counter("fraud.alert.created", "alertType", alertType, "Alerts created").increment();
    }

    @Override
    public void incrementAlertSuppressed(String alertType) {
        counter("fraud.alert.suppressed", "alertType", alertType, "Alerts suppressed as duplicates").increment();
    }

    @Override
    public void incrementRelationshipUpsert(UpsertResult result) {
        counter("fraud.relationship.upsert", "result", result.name(), "Relationship store upserts").increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
