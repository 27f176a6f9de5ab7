/**
 * Expiry FIFO queue: batch selection, retry bookkeeping with exponential backoff, and
 * dead-lettering.
 */
package membership.queue;
