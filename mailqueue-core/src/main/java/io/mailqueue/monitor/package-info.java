/**
 * Liveness metrics feed: the periodic queue-depth sampler.
 */
package io.mailqueue.monitor;
