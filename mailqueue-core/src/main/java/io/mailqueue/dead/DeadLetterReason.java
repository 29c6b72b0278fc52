package io.mailqueue.dead;

/** Why a job was moved to the dead-letter log. */
public enum DeadLetterReason {
    /** The job failed more times than the retry budget allows. */
    RETRIES_EXHAUSTED,
    /** A scheduled retry found the retry queue full. */
    RETRY_QUEUE_FULL,
    /** A retry was still pending, or could not be re-queued, when shutdown began. */
    SHUTDOWN
}
