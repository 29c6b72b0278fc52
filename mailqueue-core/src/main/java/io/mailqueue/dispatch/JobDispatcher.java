package io.mailqueue.dispatch;

import io.mailqueue.EmailJob;
import io.mailqueue.delivery.DeliveryFailedException;
import io.mailqueue.spi.EmailSender;
import io.mailqueue.spi.MetricsExporter;
import io.mailqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker pool that drains the primary and retry queues and runs each job through the
 * {@link EmailSender}.
 *
 * <p>Each of the {@code workerCount} workers alternates which queue it polls first, so
 * neither queue has priority; only liveness is guaranteed. One extra retry worker polls
 * the retry queue alone. Polls are timed, so every loop notices the shutdown signal
 * within one poll interval.
 *
 * <p>Every attempt goes through {@link #attempt(EmailJob)}, which turns whatever the
 * sender does into a {@link DeliveryOutcome}. Failures, expected or not, are handed to
 * the {@link RetryScheduler}; a fault never kills the worker that hit it.
 *
 * <p>On {@link #signalShutdown()} the loops stop taking new jobs. A job already being
 * processed runs to completion. Jobs still buffered are left in their queues.
 */
public final class JobDispatcher {
    private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

    static final long QUEUE_POLL_TIMEOUT_MS = 50;
    private static final int RETRY_WORKER_ID = 0;

    private final BoundedJobQueue primaryQueue;
    private final BoundedJobQueue retryQueue;
    private final EmailSender sender;
    private final RetryScheduler retryScheduler;
    private final MetricsExporter metrics;
    private final int workerCount;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private ExecutorService workers;
    private ExecutorService retryWorker;

    /**
     * @param primaryQueue   queue of newly submitted jobs
     * @param retryQueue     queue of jobs due for another attempt
     * @param sender         delivery operation
     * @param retryScheduler receives every failed job
     * @param metrics        metrics sink
     * @param workerCount    number of pool workers, must be &ge; 0; {@code 0} leaves the
     *                       primary queue undrained (testing only)
     */
    public JobDispatcher(BoundedJobQueue primaryQueue, BoundedJobQueue retryQueue,
            EmailSender sender, RetryScheduler retryScheduler, MetricsExporter metrics,
            int workerCount) {
        this.primaryQueue = Objects.requireNonNull(primaryQueue, "primaryQueue");
        this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0, got: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    /**
     * Launches the pool workers and the retry worker.
     *
     * @throws IllegalStateException if already started or shut down
     */
    public synchronized void start() {
        if (retryWorker != null) {
            throw new IllegalStateException("JobDispatcher already started");
        }
        if (!running.get()) {
            throw new IllegalStateException("JobDispatcher has been shut down");
        }
        if (workerCount > 0) {
            workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("email-worker-"));
            for (int i = 1; i <= workerCount; i++) {
                int workerId = i;
                workers.submit(() -> workerLoop(workerId));
            }
        } else {
            logger.warning("workerCount=0: no pool workers started; submitted jobs will not be processed");
        }
        retryWorker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("email-retry-worker-"));
        retryWorker.submit(this::retryWorkerLoop);
    }

    private void workerLoop(int workerId) {
        logger.log(Level.INFO, "Worker {0} started", workerId);
        boolean primaryFirst = (workerId & 1) == 1;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                EmailJob job = primaryFirst ? pollEither(primaryQueue, retryQueue)
                        : pollEither(retryQueue, primaryQueue);
                primaryFirst = !primaryFirst;
                if (job != null) {
                    process(job, workerId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Worker " + workerId + " loop error", t);
            }
        }
        logger.log(Level.INFO, "Worker {0} shutting down", workerId);
    }

    private void retryWorkerLoop() {
        logger.info("Retry worker started");
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                EmailJob job = retryQueue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (job != null) {
                    process(job, RETRY_WORKER_ID);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Retry worker loop error", t);
            }
        }
        logger.info("Retry worker shutting down");
    }

    EmailJob pollEither(BoundedJobQueue first, BoundedJobQueue second)
            throws InterruptedException {
        EmailJob job = first.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        // shutdown may have been raised during the first wait
        if (job == null && running.get()) {
            job = second.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        }
        return job;
    }

    private void process(EmailJob job, int workerId) {
        logger.log(Level.INFO, "Worker {0} processing email to {1}: {2}",
                new Object[]{workerId, job.to(), job.subject()});
        DeliveryOutcome outcome = attempt(job);
        if (outcome instanceof DeliveryOutcome.Failed failed) {
            Throwable cause = failed.cause();
            if (cause instanceof DeliveryFailedException) {
                logger.log(Level.WARNING, "Worker {0} failed to send email to {1}: {2}",
                        new Object[]{workerId, job.to(), cause.getMessage()});
            } else {
                logger.log(Level.WARNING, "Worker " + workerId + " recovered from fault while sending to "
                        + job.to(), cause);
            }
            retryScheduler.onFailure(job, cause);
            return;
        }
        logger.log(Level.INFO, "Worker {0} successfully sent email to {1}",
                new Object[]{workerId, job.to()});
        metrics.incrementProcessed();
    }

    DeliveryOutcome attempt(EmailJob job) {
        try {
            sender.send(job);
            return DeliveryOutcome.delivered();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryOutcome.failed(e);
        } catch (Exception e) {
            return DeliveryOutcome.failed(e);
        }
    }

    /**
     * Raises the shutdown signal. Returns immediately; use
     * {@link #awaitTermination(long, TimeUnit)} to wait for the loops to exit.
     */
    public synchronized void signalShutdown() {
        running.set(false);
        if (workers != null) {
            workers.shutdown();
        }
        if (retryWorker != null) {
            retryWorker.shutdown();
        }
    }

    /**
     * Waits for every loop to exit after {@link #signalShutdown()}.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if all loops exited (or were never started)
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        ExecutorService pool;
        ExecutorService retry;
        synchronized (this) {
            pool = workers;
            retry = retryWorker;
        }
        if (retry == null) {
            return true;
        }
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        if (pool != null && !pool.awaitTermination(timeout, unit)) {
            return false;
        }
        return retry.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    /** Interrupts every loop, including jobs mid-delivery. */
    public synchronized void forceStop() {
        running.set(false);
        if (workers != null) {
            workers.shutdownNow();
        }
        if (retryWorker != null) {
            retryWorker.shutdownNow();
        }
    }

    public int workerCount() {
        return workerCount;
    }
}
