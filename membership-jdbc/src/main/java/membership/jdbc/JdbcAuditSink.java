package membership.jdbc;

import membership.audit.AuditLogEntry;
import membership.spi.AuditSink;
import membership.spi.ConnectionProvider;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends audit entries to the audit log table.
 */
public final class JdbcAuditSink implements AuditSink {
  private final ConnectionProvider connectionProvider;
  private final TableNames tables;

  public JdbcAuditSink(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.defaults());
  }

  public JdbcAuditSink(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public void persist(List<AuditLogEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    if (entries.isEmpty()) {
      return;
    }
    String sql = "INSERT INTO " + tables.auditLog()
        + " (logged_at, entry_type, outcome, note, error, json_data) VALUES (?,?,?,?,?,?)";
    List<Object[]> rows = new ArrayList<>(entries.size());
    for (AuditLogEntry entry : entries) {
      rows.add(new Object[]{Timestamp.from(entry.timestamp()), entry.type(), entry.outcome().label(),
          entry.note(), entry.error(), entry.json()});
    }
    JdbcTemplate.inTransaction(connectionProvider, conn -> JdbcTemplate.batchUpdate(conn, sql, rows));
  }
}
