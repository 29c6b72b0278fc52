package io.mailqueue.dispatch;

import io.mailqueue.EmailJob;
import io.mailqueue.EnqueueResult;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity job buffer between producers and dispatcher workers.
 *
 * <p>Submission never blocks: a full queue rejects immediately with
 * {@link EnqueueResult#QUEUE_FULL}, and a closed queue with {@link EnqueueResult#CLOSED}.
 * Workers take jobs with a timed {@link #poll(long, TimeUnit)} so they can notice the
 * shutdown signal between waits. Capacity never changes after construction.
 *
 * <p>This class is thread-safe.
 */
public final class BoundedJobQueue {
    private final String name;
    private final int capacity;
    private final BlockingQueue<EmailJob> jobs;
    private volatile boolean closed;

    /**
     * @param name     label used in log messages
     * @param capacity maximum number of buffered jobs, must be &gt; 0
     */
    public BoundedJobQueue(String name, int capacity) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.jobs = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Offers a job without waiting.
     *
     * @param job the job to buffer
     * @return {@link EnqueueResult#ACCEPTED} if the queue took ownership of the job
     */
    public EnqueueResult offer(EmailJob job) {
        Objects.requireNonNull(job, "job");
        if (closed) {
            return EnqueueResult.CLOSED;
        }
        return jobs.offer(job) ? EnqueueResult.ACCEPTED : EnqueueResult.QUEUE_FULL;
    }

    /**
     * Waits up to {@code timeout} for a job. Returns {@code null} straight away once the
     * queue is closed and empty.
     *
     * @param timeout how long to wait
     * @param unit    unit of {@code timeout}
     * @return the next job, or {@code null} if none arrived in time
     * @throws InterruptedException if the calling worker is interrupted while waiting
     */
    public EmailJob poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed && jobs.isEmpty()) {
            return null;
        }
        return jobs.poll(timeout, unit);
    }

    /** Stops accepting jobs. Jobs already buffered stay where they are. */
    public void close() {
        closed = true;
    }

    /**
     * Moves every buffered job into {@code sink}, oldest first.
     *
     * @param sink receives the removed jobs
     * @return number of jobs moved
     */
    public int drainTo(Collection<? super EmailJob> sink) {
        return jobs.drainTo(sink);
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return jobs.size();
    }

    public int capacity() {
        return capacity;
    }

    public int remainingCapacity() {
        return jobs.remainingCapacity();
    }

    public String name() {
        return name;
    }
}
