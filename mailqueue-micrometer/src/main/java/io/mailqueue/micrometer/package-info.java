/**
 * Micrometer bridge for exporting mailqueue metrics to Prometheus and other backends.
 *
 * <p>{@link io.mailqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.mailqueue.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see io.mailqueue.micrometer.MicrometerMetricsExporter
 */
package io.mailqueue.micrometer;
