/**
 * Spring Boot auto-configuration for the email queue.
 *
 * <p>{@link io.mailqueue.spring.boot.MailQueueAutoConfiguration} wires a started
 * {@link io.mailqueue.EmailQueue} from {@code mailqueue.*} application properties.
 * {@link io.mailqueue.spring.boot.MailQueueMicrometerAutoConfiguration} feeds its metrics
 * into the application's Micrometer registry.
 *
 * @see io.mailqueue.spring.boot.MailQueueProperties
 */
package io.mailqueue.spring.boot;
