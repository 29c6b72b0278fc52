/**
 * Permanent-failure sink.
 *
 * <p>{@link io.mailqueue.dead.DeadLetterLog} keeps every job that exhausted its retries,
 * lost the race for retry-queue capacity, or was still waiting on a retry at shutdown.
 * The log is in memory only and has no eviction.
 */
package io.mailqueue.dead;
