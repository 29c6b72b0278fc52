package io.mailqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void incrementProcessed() {
        exporter.incrementProcessed();
        exporter.incrementProcessed();
        assertEquals(2.0, counter("email.jobs.processed").count());
    }

    @Test
    void incrementFailed() {
        exporter.incrementFailed();
        assertEquals(1.0, counter("email.jobs.failed").count());
    }

    @Test
    void incrementDeadLettered() {
        exporter.incrementDeadLettered();
        assertEquals(1.0, counter("email.dead.letter.jobs").count());
    }

    @Test
    void incrementRetriedAndRejected() {
        exporter.incrementRetried();
        exporter.incrementRetried();
        exporter.incrementRejected();
        assertEquals(2.0, counter("email.jobs.retried").count());
        assertEquals(1.0, counter("email.jobs.rejected").count());
    }

    @Test
    void recordQueueLengths() {
        exporter.recordQueueLength(42);
        exporter.recordRetryQueueLength(7);
        assertEquals(42.0, gauge("email.queue.length").value());
        assertEquals(7.0, gauge("email.retry.queue.length").value());

        exporter.recordQueueLength(0);
        assertEquals(0.0, gauge("email.queue.length").value());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerMetricsExporter(registry, "billing.email");
        custom.incrementProcessed();
        custom.recordQueueLength(10);

        assertEquals(1.0, counter("billing.email.jobs.processed").count());
        assertEquals(10.0, gauge("billing.email.queue.length").value());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.incrementProcessed();
        exporter.close();

        assertNull(registry.find("email.jobs.processed").counter());
        assertNull(registry.find("email.queue.length").gauge());
        assertDoesNotThrow(() -> exporter.incrementProcessed());
        assertDoesNotThrow(() -> exporter.recordQueueLength(3));
    }

    @Test
    void nullRegistryThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void invalidPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "email."));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
