package io.mailqueue.micrometer;

import io.mailqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>With the default {@code "email"} prefix a Prometheus registry exposes the meters
 * under the names in parentheses.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code email.jobs.processed} ({@code email_jobs_processed_total}): jobs delivered</li>
 *   <li>{@code email.jobs.failed} ({@code email_jobs_failed_total}): jobs failed permanently</li>
 *   <li>{@code email.dead.letter.jobs} ({@code email_dead_letter_jobs_total}): jobs moved to
 *       the dead-letter log</li>
 *   <li>{@code email.jobs.retried} ({@code email_jobs_retried_total}): retries scheduled</li>
 *   <li>{@code email.jobs.rejected} ({@code email_jobs_rejected_total}): submissions refused
 *       because the queue was full</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code email.queue.length} ({@code email_queue_length}): primary queue occupancy</li>
 *   <li>{@code email.retry.queue.length} ({@code email_retry_queue_length}): retry queue
 *       occupancy</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_NAME_PREFIX = "email";

    private final MeterRegistry registry;
    private final Counter processed;
    private final Counter failed;
    private final Counter deadLettered;
    private final Counter retried;
    private final Counter rejected;
    private final Gauge queueLengthGauge;
    private final Gauge retryQueueLengthGauge;

    private final AtomicInteger queueLength = new AtomicInteger();
    private final AtomicInteger retryQueueLength = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "email"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_NAME_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several queues
     * against one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.email"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.processed = Counter.builder(namePrefix + ".jobs.processed")
                .description("Total number of processed email jobs")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".jobs.failed")
                .description("Total number of failed email jobs")
                .register(registry);
        this.deadLettered = Counter.builder(namePrefix + ".dead.letter.jobs")
                .description("Total number of jobs moved to dead letter queue")
                .register(registry);
        this.retried = Counter.builder(namePrefix + ".jobs.retried")
                .description("Total number of retries scheduled after a failed attempt")
                .register(registry);
        this.rejected = Counter.builder(namePrefix + ".jobs.rejected")
                .description("Total number of submissions rejected because the queue was full")
                .register(registry);

        this.queueLengthGauge = Gauge.builder(namePrefix + ".queue.length", queueLength, AtomicInteger::get)
                .description("Current number of jobs in the email queue")
                .register(registry);
        this.retryQueueLengthGauge = Gauge.builder(namePrefix + ".retry.queue.length", retryQueueLength,
                        AtomicInteger::get)
                .description("Current number of jobs in the retry queue")
                .register(registry);
    }

    @Override
    public void incrementProcessed() {
        if (closed) return;
        processed.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void incrementRetried() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementRejected() {
        if (closed) return;
        rejected.increment();
    }

    @Override
    public void recordQueueLength(int length) {
        if (closed) return;
        queueLength.set(length);
    }

    @Override
    public void recordRetryQueueLength(int length) {
        if (closed) return;
        retryQueueLength.set(length);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the {@link io.mailqueue.EmailQueue} it serves is closed, so no
     * stale gauges are left behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(processed, failed, deadLettered, retried, rejected,
                queueLengthGauge, retryQueueLengthGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
