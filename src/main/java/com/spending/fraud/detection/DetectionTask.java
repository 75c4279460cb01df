package com.spending.fraud.detection;

import java.time.Duration;
import java.time.Instant;

/**
 * Tracks one rule execution within a run. Transitions are synchronized; an illegal
 * transition throws {@link IllegalStateException}.
 */
public final class DetectionTask {

    static final int MAX_ERROR_LENGTH = 200;

    private final String ruleName;
    private final String displayName;
    private TaskStatus status = TaskStatus.PENDING;
    private int alertCount;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;

    public DetectionTask(String ruleName, String displayName) {
        this.ruleName = ruleName;
        this.displayName = displayName;
    }

    synchronized void markRunning(Instant now) {
        requireStatus(TaskStatus.PENDING, TaskStatus.RUNNING);
        status = TaskStatus.RUNNING;
        startedAt = now;
    }

    synchronized void markSucceeded(int alerts, Instant now) {
        requireStatus(TaskStatus.RUNNING, TaskStatus.SUCCESS);
        status = TaskStatus.SUCCESS;
        alertCount = alerts;
        finishedAt = now;
    }

    synchronized void markFailed(String message, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + ruleName + " already " + status);
        }
        status = TaskStatus.FAILED;
        error = truncate(message);
        finishedAt = now;
    }

    private void requireStatus(TaskStatus expected, TaskStatus target) {
        if (status != expected) {
            throw new IllegalStateException("Task " + ruleName + " cannot move from " + status + " to " + target);
        }
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public synchronized TaskStatus getStatus() {
        return status;
    }

    public synchronized int getAlertCount() {
        return alertCount;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getError() {
        return error;
    }

    /**
     * Wall time between start and finish, zero when the task never started.
     */
    public synchronized Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public synchronized String toString() {
        return "DetectionTask{" +
                "ruleName='" + ruleName + '\'' +
                ", status=" + status +
                ", alertCount=" + alertCount +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
