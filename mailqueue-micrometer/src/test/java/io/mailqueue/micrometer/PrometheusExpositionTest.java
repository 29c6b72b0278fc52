package io.mailqueue.micrometer;

import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusExpositionTest {

    @Test
    void exposesPrometheusMetricNames() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MicrometerMetricsExporter exporter = new MicrometerMetricsExporter(registry);

        exporter.incrementProcessed();
        exporter.incrementFailed();
        exporter.incrementDeadLettered();
        exporter.recordQueueLength(5);

        String scrape = registry.scrape();
        assertTrue(scrape.contains("email_queue_length 5.0"), scrape);
        assertTrue(scrape.contains("email_jobs_processed_total 1.0"), scrape);
        assertTrue(scrape.contains("email_jobs_failed_total 1.0"), scrape);
        assertTrue(scrape.contains("email_dead_letter_jobs_total 1.0"), scrape);
    }
}
