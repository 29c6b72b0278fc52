package io.mailqueue.spring.boot;

import io.mailqueue.delivery.SimulatedEmailSender.FailureMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailQueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(MailQueueProperties.class);
            assertEquals(3, props.getWorkers());
            assertEquals(100, props.getQueueSize());
            assertEquals(3, props.getMaxRetries());
            assertEquals(Duration.ofSeconds(1), props.getRetryUnit());
            assertEquals(Duration.ofSeconds(1), props.getSampleInterval());
            assertEquals(Duration.ofSeconds(30), props.getShutdownTimeout());
            assertEquals(Duration.ofSeconds(1), props.getSimulation().getDeliveryTime());
            assertEquals(FailureMode.FIRST_ATTEMPT, props.getSimulation().getFailureMode());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("email", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "mailqueue.workers=8",
                "mailqueue.queue-size=20",
                "mailqueue.max-retries=5",
                "mailqueue.retry-unit=250ms",
                "mailqueue.sample-interval=2s",
                "mailqueue.shutdown-timeout=PT10S",
                "mailqueue.simulation.delivery-time=10ms",
                "mailqueue.simulation.failure-mode=PERSISTENT",
                "mailqueue.metrics.enabled=false",
                "mailqueue.metrics.name-prefix=billing.email"
        ).run(ctx -> {
            var props = ctx.getBean(MailQueueProperties.class);
            assertEquals(8, props.getWorkers());
            assertEquals(20, props.getQueueSize());
            assertEquals(5, props.getMaxRetries());
            assertEquals(Duration.ofMillis(250), props.getRetryUnit());
            assertEquals(Duration.ofSeconds(2), props.getSampleInterval());
            assertEquals(Duration.ofSeconds(10), props.getShutdownTimeout());
            assertEquals(Duration.ofMillis(10), props.getSimulation().getDeliveryTime());
            assertEquals(FailureMode.PERSISTENT, props.getSimulation().getFailureMode());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("billing.email", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(MailQueueProperties.class)
    static class PropsConfig {
    }
}
