package io.mailqueue.delivery;

/**
 * Transient delivery failure. The dispatcher retries the job with backoff until its
 * retry budget is spent.
 */
public class DeliveryFailedException extends RuntimeException {

    public DeliveryFailedException(String message) {
        super(message);
    }
}
