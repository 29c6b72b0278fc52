package io.mailqueue.spring.boot;

import io.mailqueue.delivery.SimulatedEmailSender.FailureMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the email queue.
 *
 * @see MailQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailqueue")
public class MailQueueProperties {

    /**
     * Number of worker threads draining the queue.
     */
    private int workers = 3;

    /**
     * Capacity of the primary queue. The retry queue gets half of it.
     */
    private int queueSize = 100;

    /**
     * Retries allowed per job before it is dead-lettered.
     */
    private int maxRetries = 3;

    /**
     * Backoff unit; the n-th retry waits n units.
     */
    private Duration retryUnit = Duration.ofSeconds(1);

    /**
     * Interval between queue-length gauge samples.
     */
    private Duration sampleInterval = Duration.ofSeconds(1);

    /**
     * How long closing the queue waits for in-flight jobs before interrupting workers.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private final Simulation simulation = new Simulation();
    private final Metrics metrics = new Metrics();

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getQueueSize() {
        return queueSize;
    }

    public void setQueueSize(int queueSize) {
        this.queueSize = queueSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryUnit() {
        return retryUnit;
    }

    public void setRetryUnit(Duration retryUnit) {
        this.retryUnit = retryUnit;
    }

    public Duration getSampleInterval() {
        return sampleInterval;
    }

    public void setSampleInterval(Duration sampleInterval) {
        this.sampleInterval = sampleInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Settings of the simulated sender used when no {@code EmailSender} bean is defined.
     */
    public static class Simulation {
        private Duration deliveryTime = Duration.ofSeconds(1);
        private FailureMode failureMode = FailureMode.FIRST_ATTEMPT;

        public Duration getDeliveryTime() {
            return deliveryTime;
        }

        public void setDeliveryTime(Duration deliveryTime) {
            this.deliveryTime = deliveryTime;
        }

        public FailureMode getFailureMode() {
            return failureMode;
        }

        public void setFailureMode(FailureMode failureMode) {
            this.failureMode = failureMode;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "email";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
