package io.mailqueue;

import java.util.Objects;

/**
 * One email-send job: destination, subject and body, plus a retry counter.
 *
 * <p>The text fields are fixed at construction. The retry counter is the only mutable
 * state and only ever grows by one per failed attempt. A job has exactly one owner at
 * any moment (a queue, a worker, a pending retry or the dead-letter log); hand-off
 * between owners goes through a {@link java.util.concurrent.BlockingQueue} or an
 * executor, which publishes the counter safely, so the field needs no extra
 * synchronization.
 */
public final class EmailJob {
    private final String to;
    private final String subject;
    private final String body;
    private int retries;

    /**
     * Creates a fresh job with a retry count of zero.
     *
     * @param to      destination address
     * @param subject message subject
     * @param body    message body
     */
    public EmailJob(String to, String subject, String body) {
        this(to, subject, body, 0);
    }

    /**
     * Creates a job with an explicit retry count.
     *
     * @param to      destination address
     * @param subject message subject
     * @param body    message body
     * @param retries retry count so far, must be &ge; 0
     * @throws NullPointerException     if any text field is null
     * @throws IllegalArgumentException if {@code retries} is negative
     */
    public EmailJob(String to, String subject, String body, int retries) {
        this.to = Objects.requireNonNull(to, "to");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.body = Objects.requireNonNull(body, "body");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
        }
        this.retries = retries;
    }

    public String to() {
        return to;
    }

    public String subject() {
        return subject;
    }

    public String body() {
        return body;
    }

    public int retries() {
        return retries;
    }

    /**
     * Records one failed attempt.
     *
     * @return the retry count after the increment
     */
    public int recordFailure() {
        return ++retries;
    }

    @Override
    public String toString() {
        return "EmailJob{to=" + to + ", subject=" + subject + ", retries=" + retries + "}";
    }
}
