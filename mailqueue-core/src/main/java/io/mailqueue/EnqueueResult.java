package io.mailqueue;

/**
 * Outcome of a non-blocking submission to one of the bounded job queues.
 */
public enum EnqueueResult {
    /** The job was accepted and now belongs to the queue. */
    ACCEPTED,
    /** The queue is at capacity; the job was not retained. */
    QUEUE_FULL,
    /** The queue no longer accepts jobs because shutdown has begun. */
    CLOSED;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
