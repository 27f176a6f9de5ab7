/**
 * Micrometer integration: exports membership run counters and the expiry queue depth.
 */
package membership.micrometer;
