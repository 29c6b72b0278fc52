/**
 * Built-in delivery operation. No mail is actually transmitted.
 */
package io.mailqueue.delivery;
