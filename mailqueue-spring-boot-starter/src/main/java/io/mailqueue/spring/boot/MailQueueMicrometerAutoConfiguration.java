package io.mailqueue.spring.boot;

import io.mailqueue.micrometer.MicrometerMetricsExporter;
import io.mailqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code mailqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MailQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the queue.
 */
@AutoConfiguration(
        before = MailQueueAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.prometheus.PrometheusMetricsExportAutoConfiguration"
        })
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "mailqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    @ConditionalOnBean(MeterRegistry.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, MailQueueProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
