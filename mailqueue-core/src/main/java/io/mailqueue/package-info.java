/**
 * Root API for mailqueue: an in-memory job lifecycle engine for email-send jobs.
 *
 * <h2>Core Design</h2>
 * <p>Callers submit {@link io.mailqueue.EmailJob}s through
 * {@link io.mailqueue.EmailQueue#enqueue(io.mailqueue.EmailJob)}, which never blocks: a full
 * primary queue rejects the job at once. A fixed pool of
 * {@linkplain io.mailqueue.dispatch.JobDispatcher dispatcher workers} takes jobs from the
 * primary queue and from a smaller retry queue and hands each one to an
 * {@link io.mailqueue.spi.EmailSender}.
 *
 * <p>A failed attempt increments the job's retry counter. The
 * {@linkplain io.mailqueue.dispatch.RetryScheduler retry scheduler} re-queues the job after
 * a linear backoff (1, 2, 3 units), or records it in the
 * {@linkplain io.mailqueue.dead.DeadLetterLog dead-letter log} once the budget of three
 * retries is spent or the retry queue is full. Nothing is persisted across restarts.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>mailqueue-core</b>: engine, queues, retries, dead letters (zero external deps)</li>
 *   <li><b>mailqueue-micrometer</b>: Micrometer {@link io.mailqueue.spi.MetricsExporter}</li>
 *   <li><b>mailqueue-spring-boot-starter</b>: auto-configuration and properties</li>
 *   <li><b>mailqueue-server</b>: HTTP service and Prometheus scrape endpoint</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EmailQueue queue = EmailQueue.builder()
 *         .workerCount(3)
 *         .queueCapacity(100)
 *         .build();
 * queue.start();
 *
 * if (queue.enqueue(new EmailJob("a@b.com", "Hi", "Hello")) != EnqueueResult.ACCEPTED) {
 *     // overloaded or shutting down
 * }
 *
 * queue.shutdown(Duration.ofSeconds(30));
 * }</pre>
 *
 * @see io.mailqueue.EmailQueue
 * @see io.mailqueue.EmailJob
 * @see io.mailqueue.EnqueueResult
 */
package io.mailqueue;
