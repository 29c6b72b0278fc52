package io.mailqueue.monitor;

import io.mailqueue.Await;
import io.mailqueue.EmailJob;
import io.mailqueue.RecordingMetrics;
import io.mailqueue.dispatch.BoundedJobQueue;
import io.mailqueue.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueDepthSamplerTest {

    private final RecordingMetrics metrics = new RecordingMetrics();
    private final BoundedJobQueue primary = new BoundedJobQueue("primary", 10);
    private final BoundedJobQueue retry = new BoundedJobQueue("retry", 5);

    @Test
    void sampleOnceRecordsBothQueueLengths() {
        primary.offer(job());
        primary.offer(job());
        retry.offer(job());
        QueueDepthSampler sampler = new QueueDepthSampler(primary, retry, metrics, 1000);

        sampler.sampleOnce();

        assertEquals(2, metrics.queueLength.get());
        assertEquals(1, metrics.retryQueueLength.get());
    }

    @Test
    void startedSamplerTracksQueueChanges() {
        try (QueueDepthSampler sampler = new QueueDepthSampler(primary, retry, metrics, 10)) {
            sampler.start();
            Await.until(() -> metrics.queueLength.get() == 0, 2000, "first sample");

            primary.offer(job());

            Await.until(() -> metrics.queueLength.get() == 1, 2000, "gauge follows queue");
        }
    }

    @Test
    void closedSamplerStopsRecording() {
        QueueDepthSampler sampler = new QueueDepthSampler(primary, retry, metrics, 1000);
        sampler.close();

        sampler.sampleOnce();

        assertEquals(0, metrics.samples.get());
        assertThrows(IllegalStateException.class, sampler::start);
    }

    @Test
    void failingExporterDoesNotEscape() {
        MetricsExporter broken = new RecordingMetrics() {
            @Override
            public void recordQueueLength(int length) {
                throw new IllegalStateException("registry down");
            }
        };
        QueueDepthSampler sampler = new QueueDepthSampler(primary, retry, broken, 1000);

        assertDoesNotThrow(sampler::sampleOnce);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new QueueDepthSampler(primary, retry, metrics, 0));
    }

    private static EmailJob job() {
        return new EmailJob("a@example.com", "Subject", "body");
    }
}
