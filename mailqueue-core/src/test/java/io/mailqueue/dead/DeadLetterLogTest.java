package io.mailqueue.dead;

import io.mailqueue.EmailJob;
import io.mailqueue.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadLetterLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final RecordingMetrics metrics = new RecordingMetrics();
    private final DeadLetterLog log = new DeadLetterLog(metrics, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void recordSnapshotsJobFields() {
        EmailJob job = new EmailJob("a@example.com", "This will fail!", "body", 3);
        job.recordFailure();

        DeadLetter letter = log.record(job, DeadLetterReason.RETRIES_EXHAUSTED);

        assertEquals("a@example.com", letter.to());
        assertEquals("This will fail!", letter.subject());
        assertEquals("body", letter.body());
        assertEquals(4, letter.retries());
        assertEquals(DeadLetterReason.RETRIES_EXHAUSTED, letter.reason());
        assertEquals(NOW, letter.failedAt());
    }

    @Test
    void listPreservesInsertionOrder() {
        log.record(job("first"), DeadLetterReason.RETRIES_EXHAUSTED);
        log.record(job("second"), DeadLetterReason.RETRY_QUEUE_FULL);
        log.record(job("third"), DeadLetterReason.SHUTDOWN);

        List<DeadLetter> letters = log.list();

        assertEquals(3, letters.size());
        assertEquals("first@example.com", letters.get(0).to());
        assertEquals("second@example.com", letters.get(1).to());
        assertEquals("third@example.com", letters.get(2).to());
    }

    @Test
    void listReturnsIndependentCopy() {
        log.record(job("first"), DeadLetterReason.RETRIES_EXHAUSTED);

        List<DeadLetter> copy = log.list();
        copy.clear();

        assertEquals(1, log.size());
        assertEquals(1, log.list().size());
    }

    @Test
    void eachRecordBumpsFailedAndDeadLetteredOnce() {
        log.record(job("a"), DeadLetterReason.RETRIES_EXHAUSTED);
        log.record(job("b"), DeadLetterReason.SHUTDOWN);

        assertEquals(2, metrics.failed.get());
        assertEquals(2, metrics.deadLettered.get());
        assertEquals(0, metrics.processed.get());
    }

    @Test
    void concurrentRecordsAreAllKept() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        log.record(job("t" + id + "-" + i), DeadLetterReason.RETRIES_EXHAUSTED);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(threads * perThread, log.size());
        assertEquals(threads * perThread, metrics.deadLettered.get());
    }

    @Test
    void failingExporterDoesNotLoseRecord() {
        DeadLetterLog fragile = new DeadLetterLog(new RecordingMetrics() {
            @Override
            public void incrementFailed() {
                throw new IllegalStateException("registry down");
            }
        });

        assertDoesNotThrow(() -> fragile.record(job("a"), DeadLetterReason.SHUTDOWN));

        assertEquals(1, fragile.size());
        assertEquals("a@example.com", fragile.list().get(0).to());
    }

    @Test
    void rejectsNullReason() {
        assertThrows(NullPointerException.class, () -> log.record(job("a"), null));
    }

    private static EmailJob job(String name) {
        return new EmailJob(name + "@example.com", "Subject", "body");
    }
}
