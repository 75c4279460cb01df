package com.spending.fraud.detection;

/**
 * Lifecycle of a {@link DetectionTask}: {@code PENDING -> RUNNING -> SUCCESS | FAILED}.
 * A pending task may also fail directly when the run is cancelled before it starts.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public String getCode() {
        return name().toLowerCase();
    }
}
