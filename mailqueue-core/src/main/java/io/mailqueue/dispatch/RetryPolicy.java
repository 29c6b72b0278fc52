package io.mailqueue.dispatch;

/**
 * Strategy for computing the delay before re-queuing a failed job.
 *
 * @see LinearBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retries the job's retry count after the failure (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retries);
}
