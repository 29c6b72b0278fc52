package io.mailqueue.spring.boot;

import io.mailqueue.EmailQueue;
import io.mailqueue.delivery.SimulatedEmailSender;
import io.mailqueue.dispatch.LinearBackoffRetryPolicy;
import io.mailqueue.spi.EmailSender;
import io.mailqueue.spi.MetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the email queue.
 *
 * <p>Builds a started {@link EmailQueue} from {@link MailQueueProperties}. The queue is
 * closed when the context shuts down, after the web server has stopped accepting
 * requests. An application-defined {@link EmailSender} replaces the simulated one.
 *
 * @see MailQueueProperties
 * @see MailQueueMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EmailQueue.class)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MailQueueAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(EmailSender.class)
    public SimulatedEmailSender simulatedEmailSender(MailQueueProperties props) {
        MailQueueProperties.Simulation simulation = props.getSimulation();
        return new SimulatedEmailSender(simulation.getDeliveryTime(), simulation.getFailureMode());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EmailQueue emailQueue(MailQueueProperties props,
            EmailSender sender,
            ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = EmailQueue.builder()
                .workerCount(props.getWorkers())
                .queueCapacity(props.getQueueSize())
                .maxRetries(props.getMaxRetries())
                .retryPolicy(new LinearBackoffRetryPolicy(props.getRetryUnit().toMillis()))
                .sampleIntervalMs(props.getSampleInterval().toMillis())
                .drainTimeoutMs(props.getShutdownTimeout().toMillis())
                .sender(sender);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        EmailQueue queue = builder.build();
        queue.start();
        log.info("Email queue started with {} workers, queue size {}, max retries {}",
                props.getWorkers(), props.getQueueSize(), props.getMaxRetries());
        return queue;
    }
}
