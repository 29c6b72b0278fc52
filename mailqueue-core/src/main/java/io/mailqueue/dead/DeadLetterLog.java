package io.mailqueue.dead;

import io.mailqueue.EmailJob;
import io.mailqueue.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only, in-memory log of permanently failed jobs.
 *
 * <p>A single lock guards the append, the counter updates that go with it and the
 * snapshot read, so a reader never sees a record whose counters are not yet bumped.
 * The record is stored before the counters are touched; a failing exporter is logged
 * and never loses it.
 * Records are kept in insertion order and are never removed.
 *
 * <p>This class is thread-safe.
 */
public final class DeadLetterLog {
    private static final Logger logger = Logger.getLogger(DeadLetterLog.class.getName());

    private final List<DeadLetter> records = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final MetricsExporter metrics;
    private final Clock clock;

    public DeadLetterLog(MetricsExporter metrics) {
        this(metrics, Clock.systemUTC());
    }

    public DeadLetterLog(MetricsExporter metrics, Clock clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a snapshot of {@code job} and counts it as permanently failed.
     *
     * @param job    the job that failed permanently; its owner hands it over here
     * @param reason why the job failed permanently
     * @return the stored record
     */
    public DeadLetter record(EmailJob job, DeadLetterReason reason) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(reason, "reason");
        DeadLetter letter = DeadLetter.of(job, reason, clock.instant());
        lock.writeLock().lock();
        try {
            records.add(letter);
            try {
                metrics.incrementFailed();
                metrics.incrementDeadLettered();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Metrics update failed for dead letter " + job.to(), e);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.log(Level.WARNING, "Job moved to dead letter queue: {0} ({1}, retries={2})",
                new Object[]{job.to(), reason, job.retries()});
        return letter;
    }

    /**
     * Returns the dead letters recorded so far, oldest first.
     *
     * @return an independent copy; changing it does not affect the log
     */
    public List<DeadLetter> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
