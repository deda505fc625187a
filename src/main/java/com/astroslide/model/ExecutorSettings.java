package com.astroslide.model;

public final class ExecutorSettings {

    static final int DEFAULT_WORKERS = 4;
    static final long DEFAULT_PIXEL_BUDGET = 64L * 1024 * 1024;
    static final int DEFAULT_QUEUE_DEPTH = 16;
    static final long DEFAULT_TIMEOUT_MS = 120_000;

    public final int workers;
    /** Upper bound on pixels held by in-flight requests. */
    public final long pixelBudget;
    /** Callers allowed to wait for admission before new ones are rejected. */
    public final int queueDepth;
    public final long timeoutMillis;

    public ExecutorSettings(int workers, long pixelBudget, int queueDepth, long timeoutMillis) {
        if (workers < 1 || pixelBudget < 1 || pixelBudget > Integer.MAX_VALUE || queueDepth < 0 || timeoutMillis < 1) {
            throw new IllegalArgumentException("Invalid executor settings");
        }
        this.workers = workers;
        this.pixelBudget = pixelBudget;
        this.queueDepth = queueDepth;
        this.timeoutMillis = timeoutMillis;
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(DEFAULT_WORKERS, DEFAULT_PIXEL_BUDGET, DEFAULT_QUEUE_DEPTH, DEFAULT_TIMEOUT_MS);
    }
}
