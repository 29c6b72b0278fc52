package io.mailqueue.dead;

import io.mailqueue.EmailJob;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a job at the moment it failed permanently.
 *
 * @param to       destination address
 * @param subject  message subject
 * @param body     message body
 * @param retries  retry count when the job was dead-lettered
 * @param reason   why the job was dead-lettered
 * @param failedAt when the job was dead-lettered
 */
public record DeadLetter(String to, String subject, String body, int retries,
        DeadLetterReason reason, Instant failedAt) {

    public DeadLetter {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(failedAt, "failedAt");
    }

    static DeadLetter of(EmailJob job, DeadLetterReason reason, Instant failedAt) {
        return new DeadLetter(job.to(), job.subject(), job.body(), job.retries(), reason, failedAt);
    }
}
