/**
 * Immutable records for members, transactions, schedule entries and queue items.
 */
package membership.model;
