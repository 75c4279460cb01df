package com.spending.fraud.detection;

import com.spending.fraud.concurrent.CancellationToken;
import com.spending.fraud.concurrent.UnitResult;
import com.spending.fraud.concurrent.WorkerPool;
import com.spending.fraud.logging.LogContext;
import com.spending.fraud.metrics.MetricsService;
import com.spending.fraud.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs detection rules in parallel and aggregates their outcomes. A failing rule is
 * recorded as FAILED and never affects the others; nothing a rule throws escapes
 * {@link #runAll}.
 */
public class RuleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RuleOrchestrator.class);

    static final String CANCELLED_MESSAGE = "Run cancelled before the rule started";

    private final RuleRegistry registry;
    private final DetectionContext context;
    private final MetricsService metrics;
    private final int maxWorkers;
    private final Set<CancellationToken> activeRuns = ConcurrentHashMap.newKeySet();

    public RuleOrchestrator(RuleRegistry registry, DetectionContext context, int maxWorkers) {
        this(registry, context, new NoOpMetricsService(), maxWorkers);
    }

    public RuleOrchestrator(RuleRegistry registry, DetectionContext context, MetricsService metrics, int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be > 0");
        }
        this.registry = registry;
        this.context = context;
        this.metrics = metrics;
        this.maxWorkers = maxWorkers;
    }

    /**
     * Runs every registered rule.
     */
    public RunSummary runAll() {
        return runAll(registry.rules(), maxWorkers);
    }

    /**
     * Runs one rule, looked up by name or alias.
     *
     * @throws com.spending.fraud.exception.EntityNotFoundException for an unknown name
     */
    public RunSummary runRule(String nameOrAlias) {
        return runAll(List.of(registry.resolve(nameOrAlias)), 1);
    }

    /**
     * Runs the given rules on at most {@code workers} threads and waits for all of them.
     */
    public RunSummary runAll(List<DetectionRule> rules, int workers) {
        requireUniqueNames(rules);
        String runId = LogContext.generateId();
        DetectionContext runContext = context.forNewRun();
        Clock clock = runContext.clock();
        List<DetectionTask> tasks = new ArrayList<>(rules.size());
        for (DetectionRule rule : rules) {
            tasks.add(new DetectionTask(rule.name(), rule.displayName()));
        }
        if (rules.isEmpty()) {
            return RunSummary.of(runId, tasks);
        }

        CancellationToken token = new CancellationToken();
        activeRuns.add(token);
        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("run.started rules={} workers={}", rules.size(), workers);
            if (rules.stream().anyMatch(DetectionRule::requiresGraph)) {
                prepareGraph(runContext);
            }
            List<Integer> indexes = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                indexes.add(i);
            }

            WorkerPool pool = new WorkerPool("detection", workers);
            List<UnitResult<TaskStatus>> results = pool.run(indexes,
                    i -> execute(runId, rules.get(i), tasks.get(i), runContext), token);

            for (UnitResult<TaskStatus> result : results) {
                DetectionTask task = tasks.get(result.index());
                if (result.status() == UnitResult.Status.CANCELLED) {
                    task.markFailed(CANCELLED_MESSAGE, clock.instant());
                    metrics.recordRuleDuration(task.getRuleName(), TaskStatus.FAILED, Duration.ZERO);
                } else if (result.status() == UnitResult.Status.FAILED && !task.getStatus().isTerminal()) {
                    // errors thrown past the rule's own exception handling
                    task.markFailed(describe(result.error()), clock.instant());
                    metrics.recordRuleDuration(task.getRuleName(), TaskStatus.FAILED, result.duration());
                }
            }

            RunSummary summary = RunSummary.of(runId, tasks);
            log.info("run.finished alerts={} succeeded={} failed={}",
                    summary.totalAlerts(), summary.succeeded(), summary.failed());
            return summary;
        } finally {
            activeRuns.remove(token);
        }
    }

    /**
     * Cancels the runs in progress. Rules already running finish; rules not yet started
     * are reported as FAILED.
     */
    public void cancel() {
        log.info("run.cancel active={}", activeRuns.size());
        activeRuns.forEach(CancellationToken::cancel);
    }

    private TaskStatus execute(String runId, DetectionRule rule, DetectionTask task, DetectionContext runContext) {
        Clock clock = runContext.clock();
        try (LogContext ignored = LogContext.forRule(runId, rule.name())) {
            task.markRunning(clock.instant());
            long start = System.nanoTime();
            log.info("rule.started name={}", rule.displayName());
            try {
                int alerts = rule.detect(runContext);
                task.markSucceeded(alerts, clock.instant());
                log.info("rule.finished name={} alerts={}", rule.displayName(), alerts);
            } catch (Exception e) {
                task.markFailed(describe(e), clock.instant());
                log.error("rule.failed name={} error={}", rule.displayName(), task.getError(), e);
            }
            metrics.recordRuleDuration(rule.name(), task.getStatus(), Duration.ofNanos(System.nanoTime() - start));
            return task.getStatus();
        }
    }

    private static void prepareGraph(DetectionContext runContext) {
        try {
            runContext.graph();
        } catch (RuntimeException e) {
            // the rules that need it will fail individually when they retry
            log.warn("run.graph_failed error={}", describe(e), e);
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void requireUniqueNames(List<DetectionRule> rules) {
        Set<String> seen = new HashSet<>();
        for (DetectionRule rule : rules) {
            if (!seen.add(rule.name())) {
                throw new IllegalArgumentException("Duplicate rule in run: " + rule.name());
            }
        }
    }
}
