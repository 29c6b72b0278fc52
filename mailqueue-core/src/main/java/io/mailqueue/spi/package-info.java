/**
 * Extension points of the engine: the delivery operation and the metrics sink.
 *
 * @see io.mailqueue.spi.EmailSender
 * @see io.mailqueue.spi.MetricsExporter
 */
package io.mailqueue.spi;
