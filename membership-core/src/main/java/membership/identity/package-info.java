/**
 * Identity lookup: the per-run index of active members and the resolver that maps a
 * person to at most one of them.
 */
package membership.identity;
