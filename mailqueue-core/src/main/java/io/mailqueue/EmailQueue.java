package io.mailqueue;

import io.mailqueue.dead.DeadLetter;
import io.mailqueue.dead.DeadLetterLog;
import io.mailqueue.dead.DeadLetterReason;
import io.mailqueue.delivery.SimulatedEmailSender;
import io.mailqueue.dispatch.BoundedJobQueue;
import io.mailqueue.dispatch.JobDispatcher;
import io.mailqueue.dispatch.LinearBackoffRetryPolicy;
import io.mailqueue.dispatch.RetryPolicy;
import io.mailqueue.dispatch.RetryScheduler;
import io.mailqueue.monitor.QueueDepthSampler;
import io.mailqueue.spi.EmailSender;
import io.mailqueue.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the bounded queues, {@link JobDispatcher},
 * {@link RetryScheduler}, {@link DeadLetterLog} and {@link QueueDepthSampler} into one
 * lifecycle.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * CONSTRUCTED --start()--&gt; RUNNING --shutdown()/close()--&gt; SHUTTING_DOWN --&gt; STOPPED
 * </pre>
 * <ul>
 *   <li>Jobs may be enqueued while {@code CONSTRUCTED}; they wait for {@link #start()}.</li>
 *   <li>Shutdown closes both queues (later submissions return {@link EnqueueResult#CLOSED}),
 *       signals every worker, stops the sampler and dead-letters retries still waiting on
 *       their timers. Once the workers have exited, retries left in the retry queue are
 *       dead-lettered too; new jobs left in the primary queue are abandoned.</li>
 *   <li>{@link #shutdown(Duration)} waits for the workers up to the caller's timeout and
 *       never forces them. {@link #close()} waits for the configured drain timeout and
 *       interrupts whatever is still running after that.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EmailQueue queue = EmailQueue.builder()
 *         .workerCount(3)
 *         .queueCapacity(100)
 *         .metrics(exporter)
 *         .build()) {
 *     queue.start();
 *     EnqueueResult result = queue.enqueue(new EmailJob("a@b.com", "Hi", "Hello"));
 * }
 * }</pre>
 *
 * @see EmailQueue.Builder
 */
public final class EmailQueue implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EmailQueue.class.getName());

    /** Lifecycle states, in the only order they can occur. */
    public enum State {
        CONSTRUCTED,
        RUNNING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.CONSTRUCTED);
    private final BoundedJobQueue primaryQueue;
    private final BoundedJobQueue retryQueue;
    private final DeadLetterLog deadLetters;
    private final RetryScheduler retryScheduler;
    private final JobDispatcher dispatcher;
    private final QueueDepthSampler sampler;
    private final MetricsExporter metrics;
    private final int workerCount;
    private final long drainTimeoutMs;

    private EmailQueue(Builder builder) {
        if (builder.workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
        if (builder.queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (builder.sampleIntervalMs <= 0) {
            throw new IllegalArgumentException("sampleIntervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        RetryPolicy retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new LinearBackoffRetryPolicy(1000);
        EmailSender sender = builder.sender != null ? builder.sender : new SimulatedEmailSender();
        this.workerCount = builder.workerCount;
        this.drainTimeoutMs = builder.drainTimeoutMs;

        this.primaryQueue = new BoundedJobQueue("primary", builder.queueCapacity);
        this.retryQueue = new BoundedJobQueue("retry", retryCapacityFor(builder.queueCapacity));
        this.deadLetters = new DeadLetterLog(metrics);
        this.retryScheduler = new RetryScheduler(
                retryQueue, deadLetters, retryPolicy, builder.maxRetries, metrics);
        this.dispatcher = new JobDispatcher(
                primaryQueue, retryQueue, sender, retryScheduler, metrics, workerCount);
        this.sampler = new QueueDepthSampler(primaryQueue, retryQueue, metrics, builder.sampleIntervalMs);
    }

    /**
     * Retry queue capacity derived from the primary capacity: half, rounded down, at least 1.
     *
     * @param queueCapacity primary queue capacity
     * @return retry queue capacity
     */
    static int retryCapacityFor(int queueCapacity) {
        return Math.max(1, queueCapacity / 2);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Launches the workers, the retry worker, the retry timer and the queue-depth sampler.
     *
     * @throws IllegalStateException if called more than once or after shutdown
     */
    public void start() {
        if (!state.compareAndSet(State.CONSTRUCTED, State.RUNNING)) {
            throw new IllegalStateException("Cannot start EmailQueue in state " + state.get());
        }
        retryScheduler.start();
        dispatcher.start();
        sampler.start();
        logger.log(Level.INFO, "Started {0} workers with queue size {1}",
                new Object[]{workerCount, primaryQueue.capacity()});
    }

    /**
     * Submits a new job without blocking.
     *
     * @param job the job to submit
     * @return {@link EnqueueResult#ACCEPTED}, {@link EnqueueResult#QUEUE_FULL} if the primary
     *     queue is at capacity, or {@link EnqueueResult#CLOSED} once shutdown has begun
     */
    public EnqueueResult enqueue(EmailJob job) {
        EnqueueResult result = primaryQueue.offer(job);
        if (result == EnqueueResult.QUEUE_FULL) {
            metrics.incrementRejected();
        }
        return result;
    }

    /**
     * Returns the dead-letter records collected so far, oldest first.
     *
     * @return an independent copy of the dead-letter log
     */
    public List<DeadLetter> deadLetters() {
        return deadLetters.list();
    }

    /**
     * Begins shutdown if it has not begun yet, then waits up to {@code timeout} for every
     * worker to exit. Workers still running when the timeout elapses are left alone.
     *
     * @param timeout how long the caller is willing to wait
     * @return {@code true} if the engine reached {@link State#STOPPED}
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        initiateShutdown();
        if (dispatcher.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            markStopped();
            return true;
        }
        logger.log(Level.WARNING, "Workers still running after {0} ms", timeout.toMillis());
        return false;
    }

    private void initiateShutdown() {
        while (true) {
            State current = state.get();
            if (current == State.SHUTTING_DOWN || current == State.STOPPED) {
                return;
            }
            if (state.compareAndSet(current, State.SHUTTING_DOWN)) {
                break;
            }
        }
        logger.info("Shutting down email service...");
        primaryQueue.close();
        retryQueue.close();
        dispatcher.signalShutdown();
        sampler.close();
        retryScheduler.close();
    }

    private void markStopped() {
        if (!state.compareAndSet(State.SHUTTING_DOWN, State.STOPPED)) {
            return;
        }
        List<EmailJob> unretried = new ArrayList<>();
        retryQueue.drainTo(unretried);
        for (EmailJob job : unretried) {
            deadLetters.record(job, DeadLetterReason.SHUTDOWN);
        }
        if (!unretried.isEmpty()) {
            logger.log(Level.WARNING, "Dead-lettered {0} retries still queued at shutdown", unretried.size());
        }
        int abandoned = primaryQueue.size();
        if (abandoned > 0) {
            logger.log(Level.WARNING, "Abandoned {0} queued jobs at shutdown", abandoned);
        }
        logger.info("Email service shutdown complete");
    }

    /**
     * Shuts down using the configured drain timeout, then interrupts any worker still
     * running. Idempotent.
     */
    @Override
    public void close() {
        try {
            if (shutdown(Duration.ofMillis(drainTimeoutMs))) {
                return;
            }
            logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
                    + "Primary remaining: " + primaryQueue.size() + ", Retry remaining: " + retryQueue.size());
            dispatcher.forceStop();
            if (dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                markStopped();
            }
        } catch (InterruptedException e) {
            dispatcher.forceStop();
            Thread.currentThread().interrupt();
        }
    }

    public State state() {
        return state.get();
    }

    /**
     * Returns the current primary queue occupancy.
     *
     * @return number of jobs waiting in the primary queue
     */
    public int queueLength() {
        return primaryQueue.size();
    }

    public int retryQueueLength() {
        return retryQueue.size();
    }

    public int queueCapacity() {
        return primaryQueue.capacity();
    }

    public int retryQueueCapacity() {
        return retryQueue.capacity();
    }

    public int workerCount() {
        return workerCount;
    }

    /**
     * Returns the number of retries still waiting for their delay to elapse.
     *
     * @return pending retry count
     */
    public int pendingRetries() {
        return retryScheduler.pendingCount();
    }

    /** Builder for {@link EmailQueue}. */
    public static final class Builder {
        private int workerCount = 3;
        private int queueCapacity = 100;
        private int maxRetries = 3;
        private RetryPolicy retryPolicy;
        private EmailSender sender;
        private MetricsExporter metrics;
        private long sampleIntervalMs = 1000;
        private long drainTimeoutMs = 30_000;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {}

        /**
         * Sets the number of pool workers.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0. Setting to {@code 0} leaves the
         * primary queue undrained (useful for testing only).
         *
         * @param workerCount number of worker threads
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets the primary queue capacity. The retry queue gets half of it, at least 1.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param queueCapacity maximum number of waiting jobs
         * @return this builder
         */
        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Sets how many retries a job gets before it is dead-lettered.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         *
         * @param maxRetries retry budget per job
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the delay policy between a failure and the retry.
         *
         * <p>Optional. Defaults to {@link LinearBackoffRetryPolicy} with a one-second unit.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the delivery operation.
         *
         * <p>Optional. Defaults to {@link SimulatedEmailSender} with a one-second delivery time.
         *
         * @param sender the delivery operation
         * @return this builder
         */
        public Builder sender(EmailSender sender) {
            this.sender = sender;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the queue-depth sampling interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param sampleIntervalMs sampling interval
         * @return this builder
         */
        public Builder sampleIntervalMs(long sampleIntervalMs) {
            this.sampleIntervalMs = sampleIntervalMs;
            return this;
        }

        /**
         * Sets how long {@link EmailQueue#close()} waits for workers before interrupting them.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the engine. Call {@link EmailQueue#start()} to begin processing.
         *
         * @return a new {@link EmailQueue} in state {@link State#CONSTRUCTED}
         * @throws IllegalStateException    if this builder was already used
         * @throws IllegalArgumentException if any numeric setting is out of range
         */
        public EmailQueue build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            return new EmailQueue(this);
        }
    }
}
