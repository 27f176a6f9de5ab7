/**
 * Membership reconciliation and expiry engine.
 *
 * <p>{@link membership.MembershipManager} is the entry point; it wires the engine
 * components to the SPIs in {@link membership.spi}.
 * {@link membership.MembershipScheduler} runs it periodically.
 */
package membership;
