/**
 * Service provider interfaces the engine calls out to: storage, email, group
 * membership, audit and metrics.
 */
package membership.spi;
