package membership.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, derived from a common prefix.
 *
 * <p>The bundled {@code membership/schema.sql} creates the tables for
 * {@link #DEFAULT_PREFIX}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "membership_";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private static final TableNames DEFAULTS = new TableNames(DEFAULT_PREFIX);

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames defaults() {
    return DEFAULTS;
  }

  /**
   * @param prefix table name prefix, for example {@code "club_"}
   * @throws IllegalArgumentException if the prefix would not form valid table names
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    validate(prefix + "member");
    return new TableNames(prefix);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String prefix() {
    return prefix;
  }

  public String members() {
    return prefix + "member";
  }

  public String transactions() {
    return prefix + "transaction";
  }

  public String schedule() {
    return prefix + "schedule";
  }

  public String migrators() {
    return prefix + "migrator";
  }

  public String actionSpecs() {
    return prefix + "action_spec";
  }

  public String expiryQueue() {
    return prefix + "expiry_queue";
  }

  public String deadLetters() {
    return prefix + "dead_letter";
  }

  public String auditLog() {
    return prefix + "audit_log";
  }

  public String ambiguousTransactions() {
    return prefix + "ambiguous_transaction";
  }
}
