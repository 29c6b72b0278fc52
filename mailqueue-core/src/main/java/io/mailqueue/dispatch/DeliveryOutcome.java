package io.mailqueue.dispatch;

import java.util.Objects;

/**
 * Result of one delivery attempt, as seen by the dispatcher.
 *
 * <p>Every attempt is reduced to one of these values, whether the sender returned
 * normally, threw a delivery failure, or blew up with an unexpected fault. The worker
 * loop therefore handles a crashed attempt exactly like a failed one.
 *
 * <ul>
 *   <li>{@link Delivered}: the sender returned normally.</li>
 *   <li>{@link Failed}: the sender threw; {@link Failed#cause()} carries the fault.</li>
 * </ul>
 */
public sealed interface DeliveryOutcome permits DeliveryOutcome.Delivered, DeliveryOutcome.Failed {

    /** Singleton for a successful attempt. */
    Delivered DELIVERED = new Delivered();

    static Delivered delivered() {
        return DELIVERED;
    }

    static Failed failed(Throwable cause) {
        return new Failed(cause);
    }

    /** The attempt succeeded. */
    record Delivered() implements DeliveryOutcome {
    }

    /**
     * The attempt failed.
     *
     * @param cause what the sender threw (never null)
     */
    record Failed(Throwable cause) implements DeliveryOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
