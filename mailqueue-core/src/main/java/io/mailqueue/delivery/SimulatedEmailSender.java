package io.mailqueue.delivery;

import io.mailqueue.EmailJob;
import io.mailqueue.spi.EmailSender;

import java.time.Duration;
import java.util.Objects;

/**
 * Stand-in for a real mail transport: holds the worker for a fixed delivery time,
 * then succeeds or fails deterministically.
 *
 * <p>A job is <em>failure-prone</em> when its subject is longer than 10 characters and
 * ends with {@code '!'}. What happens to such a job depends on the {@link FailureMode}:
 * <ul>
 *   <li>{@link FailureMode#FIRST_ATTEMPT} fails it only while its retry count is 0, so
 *       the first retry succeeds</li>
 *   <li>{@link FailureMode#PERSISTENT} fails it on every attempt, so it exhausts its
 *       retries and ends up dead-lettered</li>
 * </ul>
 */
public final class SimulatedEmailSender implements EmailSender {
    private static final int FAILURE_SUBJECT_MIN_LENGTH = 11;

    /** Which attempts of a failure-prone job fail. */
    public enum FailureMode {
        /** Fail only the first attempt (retry count 0). */
        FIRST_ATTEMPT,
        /** Fail every attempt. */
        PERSISTENT
    }

    private final Duration deliveryTime;
    private final FailureMode failureMode;

    public SimulatedEmailSender() {
        this(Duration.ofSeconds(1), FailureMode.FIRST_ATTEMPT);
    }

    /**
     * @param deliveryTime how long each attempt blocks the worker, must be &ge; 0
     * @param failureMode  which attempts of a failure-prone job fail
     */
    public SimulatedEmailSender(Duration deliveryTime, FailureMode failureMode) {
        this.deliveryTime = Objects.requireNonNull(deliveryTime, "deliveryTime");
        this.failureMode = Objects.requireNonNull(failureMode, "failureMode");
        if (deliveryTime.isNegative()) {
            throw new IllegalArgumentException("deliveryTime must be >= 0, got: " + deliveryTime);
        }
    }

    @Override
    public void send(EmailJob job) throws InterruptedException {
        if (!deliveryTime.isZero()) {
            Thread.sleep(deliveryTime.toMillis());
        }
        if (shouldFail(job)) {
            throw new DeliveryFailedException("Simulated delivery failure to " + job.to());
        }
    }

    /**
     * Returns whether the next attempt of {@code job} fails.
     *
     * @param job the job about to be attempted
     * @return {@code true} if the attempt fails
     */
    public boolean shouldFail(EmailJob job) {
        if (!isFailureProne(job.subject())) {
            return false;
        }
        return failureMode == FailureMode.PERSISTENT || job.retries() == 0;
    }

    static boolean isFailureProne(String subject) {
        return subject.length() >= FAILURE_SUBJECT_MIN_LENGTH && subject.endsWith("!");
    }

    public Duration deliveryTime() {
        return deliveryTime;
    }

    public FailureMode failureMode() {
        return failureMode;
    }
}
