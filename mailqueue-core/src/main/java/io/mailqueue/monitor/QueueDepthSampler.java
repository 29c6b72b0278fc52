package io.mailqueue.monitor;

import io.mailqueue.dispatch.BoundedJobQueue;
import io.mailqueue.spi.MetricsExporter;
import io.mailqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically copies queue occupancy into the queue-length gauges.
 *
 * <p>Runs on a single daemon thread at a fixed rate. Counters are not touched here;
 * they are incremented where the events happen.
 */
public final class QueueDepthSampler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueueDepthSampler.class.getName());

    private final BoundedJobQueue primaryQueue;
    private final BoundedJobQueue retryQueue;
    private final MetricsExporter metrics;
    private final long intervalMs;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sampleTask;
    private volatile boolean closed;

    /**
     * @param primaryQueue queue reported as the queue-length gauge
     * @param retryQueue   queue reported as the retry-queue-length gauge
     * @param metrics      metrics sink
     * @param intervalMs   sampling interval in milliseconds, must be &gt; 0
     */
    public QueueDepthSampler(BoundedJobQueue primaryQueue, BoundedJobQueue retryQueue,
            MetricsExporter metrics, long intervalMs) {
        this.primaryQueue = Objects.requireNonNull(primaryQueue, "primaryQueue");
        this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0, got: " + intervalMs);
        }
        this.intervalMs = intervalMs;
    }

    /**
     * Starts sampling. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("QueueDepthSampler has been closed");
        }
        if (sampleTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("email-queue-monitor-"));
        sampleTask = scheduler.scheduleAtFixedRate(
                this::sampleOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Takes a single sample. May be invoked directly for testing.
     */
    public void sampleOnce() {
        if (closed) {
            return;
        }
        try {
            metrics.recordQueueLength(primaryQueue.size());
            metrics.recordRetryQueueLength(retryQueue.size());
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Queue depth sample failed", t);
        }
    }

    /** Stops sampling and shuts down the sampler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (sampleTask != null) {
            sampleTask.cancel(false);
            sampleTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
