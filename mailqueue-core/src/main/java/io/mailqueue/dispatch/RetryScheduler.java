package io.mailqueue.dispatch;

import io.mailqueue.EmailJob;
import io.mailqueue.EnqueueResult;
import io.mailqueue.dead.DeadLetterLog;
import io.mailqueue.dead.DeadLetterReason;
import io.mailqueue.spi.MetricsExporter;
import io.mailqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides what happens to a job after a failed attempt: a delayed retry or the
 * dead-letter log.
 *
 * <p>Each failure increments the job's retry counter. While the counter is within
 * {@code maxRetries}, a one-shot task is scheduled for that job alone, after the delay
 * given by the {@link RetryPolicy}; no worker waits on it. When the task fires, the job
 * is offered to the retry queue without blocking, and a full queue sends it straight to
 * the dead-letter log instead of backing off again. Past {@code maxRetries} the job is
 * dead-lettered immediately.
 *
 * <p>Every scheduled retry sits in a pending set until it is claimed, either by its own
 * timer or by {@link #close()}. The claim is a single {@code remove}, so each retry is
 * resolved exactly once. On close, unclaimed retries are dead-lettered with
 * {@link DeadLetterReason#SHUTDOWN}.
 *
 * <p>This class is thread-safe.
 */
public final class RetryScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

    private final BoundedJobQueue retryQueue;
    private final DeadLetterLog deadLetters;
    private final RetryPolicy retryPolicy;
    private final int maxRetries;
    private final MetricsExporter metrics;
    private final Set<EmailJob> pending = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService timer;
    private volatile boolean closed;

    /**
     * @param retryQueue  destination for jobs whose delay has elapsed
     * @param deadLetters sink for jobs that will not be retried
     * @param retryPolicy delay before each retry
     * @param maxRetries  retries allowed per job, must be &ge; 0
     * @param metrics     metrics sink
     */
    public RetryScheduler(BoundedJobQueue retryQueue, DeadLetterLog deadLetters,
            RetryPolicy retryPolicy, int maxRetries, MetricsExporter metrics) {
        this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    /**
     * Starts the timer thread. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetryScheduler has been closed");
        }
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("email-retry-timer-"));
    }

    /**
     * Handles a failed attempt. The caller hands ownership of {@code job} over to this
     * scheduler.
     *
     * @param job   the job whose attempt failed
     * @param cause what made the attempt fail
     */
    public void onFailure(EmailJob job, Throwable cause) {
        int retries = job.recordFailure();
        if (retries > maxRetries) {
            logger.log(Level.WARNING, "Job permanently failed after {0} retries: {1}",
                    new Object[]{maxRetries, job.to()});
            deadLetters.record(job, DeadLetterReason.RETRIES_EXHAUSTED);
            return;
        }
        long delayMs = retryPolicy.computeDelayMs(retries);
        logger.log(Level.INFO, "Job failed, retrying ({0}/{1}) in {2} ms: {3}",
                new Object[]{retries, maxRetries, delayMs, job.to()});
        metrics.incrementRetried();
        schedule(job, delayMs);
    }

    private void schedule(EmailJob job, long delayMs) {
        pending.add(job);
        ScheduledExecutorService current;
        synchronized (this) {
            current = timer;
        }
        if (closed || current == null) {
            resolveOnShutdown(job);
            return;
        }
        try {
            current.schedule(() -> fire(job), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // timer shut down between the check and the call
            resolveOnShutdown(job);
        }
    }

    private void fire(EmailJob job) {
        if (!pending.remove(job)) {
            return;
        }
        try {
            EnqueueResult result = retryQueue.offer(job);
            switch (result) {
                case ACCEPTED -> {
                }
                case QUEUE_FULL -> {
                    logger.log(Level.WARNING, "Retry queue full, dropping retry of {0}", job.to());
                    deadLetters.record(job, DeadLetterReason.RETRY_QUEUE_FULL);
                }
                case CLOSED -> deadLetters.record(job, DeadLetterReason.SHUTDOWN);
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retry re-submission failed, job lost: " + job, t);
        }
    }

    private void resolveOnShutdown(EmailJob job) {
        if (pending.remove(job)) {
            deadLetters.record(job, DeadLetterReason.SHUTDOWN);
        }
    }

    /**
     * Returns the number of retries still waiting for their delay to elapse.
     *
     * @return pending retry count
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Cancels every timer and dead-letters the retries that had not fired yet. Later
     * failures are dead-lettered straight away.
     */
    @Override
    public void close() {
        ScheduledExecutorService current;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            current = timer;
        }
        if (current != null) {
            current.shutdownNow();
        }
        int abandoned = 0;
        for (EmailJob job : pending) {
            if (pending.remove(job)) {
                deadLetters.record(job, DeadLetterReason.SHUTDOWN);
                abandoned++;
            }
        }
        if (abandoned > 0) {
            logger.log(Level.WARNING, "Dead-lettered {0} retries still pending at shutdown", abandoned);
        }
        if (current != null) {
            try {
                current.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
