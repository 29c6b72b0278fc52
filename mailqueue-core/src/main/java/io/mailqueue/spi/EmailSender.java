package io.mailqueue.spi;

import io.mailqueue.EmailJob;

/**
 * Delivery operation invoked by a dispatcher worker for each attempt of a job.
 *
 * <p>Senders run <b>synchronously</b> on worker threads, so a slow sender holds its
 * worker for the whole attempt and the primary queue fills up behind it.
 *
 * <h2>Error Handling</h2>
 * <p>Any exception thrown from {@link #send(EmailJob)} counts as a failed attempt:
 * <ul>
 *   <li>the job's retry counter is incremented and a delayed retry is scheduled</li>
 *   <li>once the retry budget is spent, the job goes to the dead-letter log</li>
 * </ul>
 * Unexpected runtime faults are treated the same way as deliberate failures.
 *
 * @see io.mailqueue.delivery.SimulatedEmailSender
 */
@FunctionalInterface
public interface EmailSender {

    /**
     * Attempts to deliver the job.
     *
     * @param job the job being attempted; implementations must not change it
     * @throws Exception if the attempt fails
     */
    void send(EmailJob job) throws Exception;
}
