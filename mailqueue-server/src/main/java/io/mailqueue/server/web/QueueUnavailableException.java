package io.mailqueue.server.web;

import io.mailqueue.EnqueueResult;

/**
 * Raised when the queue refuses a submission, because it is full or shutting down.
 */
public class QueueUnavailableException extends RuntimeException {

    private final EnqueueResult result;

    public QueueUnavailableException(EnqueueResult result) {
        super(result == EnqueueResult.CLOSED ? "Service is shutting down" : "Queue is full");
        this.result = result;
    }

    public EnqueueResult result() {
        return result;
    }
}
