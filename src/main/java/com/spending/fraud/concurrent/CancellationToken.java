package com.spending.fraud.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and the units it submitted.
 * Units that have not started when the flag is raised are skipped; running units finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * A token that is never cancelled by anyone else.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
