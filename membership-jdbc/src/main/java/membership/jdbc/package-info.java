/**
 * JDBC implementations of the membership storage SPIs.
 *
 * <p>{@link membership.jdbc.JdbcMembershipStore} holds the member, transaction,
 * schedule, migration and action spec tables; {@link membership.jdbc.JdbcExpiryQueueStore}
 * the expiry queue and its dead letters. {@link membership.jdbc.JdbcAuditSink} and
 * {@link membership.jdbc.JdbcAmbiguousTransactionStore} are append-only.
 * The default DDL ships as {@code membership/schema.sql}.
 *
 * @see membership.jdbc.TableNames
 */
package membership.jdbc;
