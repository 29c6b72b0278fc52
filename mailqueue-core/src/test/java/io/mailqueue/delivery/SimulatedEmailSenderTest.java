package io.mailqueue.delivery;

import io.mailqueue.EmailJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedEmailSenderTest {

    @Test
    void failureProneSubjectsAreLongAndEndWithBang() {
        assertTrue(SimulatedEmailSender.isFailureProne("This will fail!"));
        assertTrue(SimulatedEmailSender.isFailureProne("0123456789!"));
        assertFalse(SimulatedEmailSender.isFailureProne("012345678!"));
        assertFalse(SimulatedEmailSender.isFailureProne("Hi!"));
        assertFalse(SimulatedEmailSender.isFailureProne("This will not fail"));
        assertFalse(SimulatedEmailSender.isFailureProne(""));
    }

    @Test
    void firstAttemptModeFailsOnlyBeforeFirstRetry() {
        SimulatedEmailSender sender = new SimulatedEmailSender(Duration.ZERO,
                SimulatedEmailSender.FailureMode.FIRST_ATTEMPT);

        assertTrue(sender.shouldFail(new EmailJob("a@example.com", "This will fail!", "b")));
        assertFalse(sender.shouldFail(new EmailJob("a@example.com", "This will fail!", "b", 1)));
    }

    @Test
    void persistentModeFailsEveryAttempt() {
        SimulatedEmailSender sender = new SimulatedEmailSender(Duration.ZERO,
                SimulatedEmailSender.FailureMode.PERSISTENT);

        for (int retries = 0; retries <= 4; retries++) {
            assertTrue(sender.shouldFail(new EmailJob("a@example.com", "This will fail!", "b", retries)));
        }
        assertFalse(sender.shouldFail(new EmailJob("a@example.com", "Welcome", "b", 2)));
    }

    @Test
    void sendThrowsDeliveryFailure() {
        SimulatedEmailSender sender = new SimulatedEmailSender(Duration.ZERO,
                SimulatedEmailSender.FailureMode.FIRST_ATTEMPT);

        DeliveryFailedException e = assertThrows(DeliveryFailedException.class,
                () -> sender.send(new EmailJob("a@example.com", "This will fail!", "b")));
        assertTrue(e.getMessage().contains("a@example.com"));
    }

    @Test
    void sendHoldsForDeliveryTime() throws Exception {
        SimulatedEmailSender sender = new SimulatedEmailSender(Duration.ofMillis(50),
                SimulatedEmailSender.FailureMode.FIRST_ATTEMPT);

        long start = System.nanoTime();
        sender.send(new EmailJob("a@example.com", "Welcome", "b"));

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 45);
    }

    @Test
    void defaultsToOneSecondFirstAttempt() {
        SimulatedEmailSender sender = new SimulatedEmailSender();

        assertEquals(Duration.ofSeconds(1), sender.deliveryTime());
        assertEquals(SimulatedEmailSender.FailureMode.FIRST_ATTEMPT, sender.failureMode());
    }

    @Test
    void rejectsNegativeDeliveryTime() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedEmailSender(
                Duration.ofMillis(-1), SimulatedEmailSender.FailureMode.PERSISTENT));
    }
}
