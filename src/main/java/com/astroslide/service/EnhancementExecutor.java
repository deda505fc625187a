package com.astroslide.service;

import com.astroslide.model.EnhancementException;
import com.astroslide.model.ErrorKind;
import com.astroslide.model.ExecutorSettings;
import com.astroslide.model.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed worker pool with pixel-budget admission. Each request holds permits equal to its
 * pixel count (capped at the whole budget) from admission until its worker stops. Callers
 * that cannot be admitted immediately wait, up to {@code queueDepth} of them at a time.
 */
public class EnhancementExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EnhancementExecutor.class);

    /** Work executed on a pool thread under the given run. */
    @FunctionalInterface
    public interface Job<T> {
        T run(PipelineRun run) throws EnhancementException;
    }

    private final ExecutorSettings settings;
    private final ExecutorService pool;
    private final Semaphore permits;
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicLong inFlight = new AtomicLong();

    public EnhancementExecutor(ExecutorSettings settings) {
        this.settings = settings;
        this.permits = new Semaphore((int) settings.pixelBudget, true);
        this.pool = Executors.newFixedThreadPool(settings.workers, new WorkerThreadFactory());
    }

    public ExecutorSettings getSettings() {
        return settings;
    }

    public <T> T submit(long pixels, Job<T> job) throws EnhancementException {
        return submit(pixels, job, new PipelineRun());
    }

    public <T> T submit(long pixels, Job<T> job, PipelineRun run) throws EnhancementException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.timeoutMillis);
        int cost = (int) Math.max(1, Math.min(pixels, settings.pixelBudget));

        admit(cost, deadline);
        inFlight.addAndGet(cost);

        Future<T> future;
        try {
            future = pool.submit(() -> {
                try {
                    return job.run(run);
                } finally {
                    release(cost);
                }
            });
        } catch (RejectedExecutionException e) {
            release(cost);
            throw new EnhancementException(ErrorKind.INTERNAL, "Executor is shut down", e);
        }

        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            run.cancel();
            log.warn("Request of {} pixels timed out after {} ms at {}", pixels, settings.timeoutMillis, run);
            throw new EnhancementException(ErrorKind.TIMEOUT,
                    "Request exceeded " + settings.timeoutMillis + " ms");
        } catch (InterruptedException e) {
            run.cancel();
            Thread.currentThread().interrupt();
            throw new EnhancementException(ErrorKind.CANCELLED, "Interrupted while waiting for result", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EnhancementException) throw (EnhancementException) cause;
            log.error("Worker failed", cause);
            throw new EnhancementException(ErrorKind.INTERNAL, "Worker failed: " + cause, cause);
        }
    }

    private void admit(int cost, long deadline) throws EnhancementException {
        try {
            if (permits.tryAcquire(cost, 0, TimeUnit.NANOSECONDS)) return;

            if (waiting.incrementAndGet() > settings.queueDepth) {
                waiting.decrementAndGet();
                throw new EnhancementException(ErrorKind.CAPACITY_EXCEEDED,
                        "Admission queue full (" + settings.queueDepth + " waiting)");
            }
            try {
                if (!permits.tryAcquire(cost, Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    throw new EnhancementException(ErrorKind.TIMEOUT,
                            "Not admitted within " + settings.timeoutMillis + " ms");
                }
            } finally {
                waiting.decrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnhancementException(ErrorKind.CANCELLED, "Interrupted while waiting for admission", e);
        }
    }

    private void release(int cost) {
        inFlight.addAndGet(-cost);
        permits.release(cost);
    }

    /** Callers currently waiting for admission. */
    public int queuedRequests() {
        return waiting.get();
    }

    /** Permits held by admitted requests whose workers have not stopped yet. */
    public long inFlightPixels() {
        return inFlight.get();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "enhance-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
