/**
 * Job dispatch: bounded queues, the worker pool and retry scheduling.
 *
 * <p>{@link io.mailqueue.dispatch.JobDispatcher} drains a primary queue (new jobs) and a
 * retry queue (jobs due for another attempt). Failed attempts go to the
 * {@link io.mailqueue.dispatch.RetryScheduler}, which re-queues them after a
 * {@link io.mailqueue.dispatch.RetryPolicy} delay or sends them to the dead-letter log.
 *
 * @see io.mailqueue.dispatch.JobDispatcher
 * @see io.mailqueue.dispatch.BoundedJobQueue
 * @see io.mailqueue.dispatch.RetryScheduler
 * @see io.mailqueue.dispatch.DeliveryOutcome
 */
package io.mailqueue.dispatch;
