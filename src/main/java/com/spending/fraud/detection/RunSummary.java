package com.spending.fraud.detection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one orchestrated run. Tasks are in registry order.
 */
public record RunSummary(String runId, int totalAlerts, int succeeded, int failed, List<DetectionTask> tasks) {

    public RunSummary {
        tasks = List.copyOf(tasks);
    }

    static RunSummary of(String runId, List<DetectionTask> tasks) {
        int alerts = 0;
        int ok = 0;
        int bad = 0;
        for (DetectionTask task : tasks) {
            if (task.getStatus() == TaskStatus.SUCCESS) {
                ok++;
                alerts += task.getAlertCount();
            } else if (task.getStatus() == TaskStatus.FAILED) {
                bad++;
            }
        }
        return new RunSummary(runId, alerts, ok, bad, tasks);
    }

    /**
     * Alerts created per rule name; failed rules map to zero.
     */
    public Map<String, Integer> perRule() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DetectionTask task : tasks) {
            counts.put(task.getRuleName(), task.getAlertCount());
        }
        return counts;
    }

    public Optional<DetectionTask> task(String ruleName) {
        return tasks.stream().filter(t -> t.getRuleName().equals(ruleName)).findFirst();
    }

    public boolean allSucceeded() {
        return failed == 0;
    }
}
