package io.mailqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implementations must
 * tolerate concurrent calls from every worker thread.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs delivered successfully.
     */
    void incrementProcessed();

    /**
     * Increments the count of jobs that failed permanently.
     */
    void incrementFailed();

    /**
     * Increments the count of jobs moved to the dead-letter log.
     */
    void incrementDeadLettered();

    /**
     * Records the current occupancy of the primary queue.
     *
     * @param length number of jobs waiting in the primary queue
     */
    void recordQueueLength(int length);

    /**
     * Records the current occupancy of the retry queue.
     *
     * @param length number of jobs waiting in the retry queue
     */
    default void recordRetryQueueLength(int length) {
    }

    /**
     * Increments the count of retries scheduled after a failed attempt.
     */
    default void incrementRetried() {
    }

    /**
     * Increments the count of submissions rejected because the primary queue was full.
     */
    default void incrementRejected() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementProcessed() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void recordQueueLength(int length) {
        }
    }
}
