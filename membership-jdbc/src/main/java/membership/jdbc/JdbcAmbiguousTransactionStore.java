package membership.jdbc;

import membership.model.AmbiguousTransaction;
import membership.spi.AmbiguousTransactionStore;
import membership.spi.ConnectionProvider;
import membership.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the review table in step with the transactions awaiting review. Each write
 * replaces the table in one transaction. The full row is kept as JSON next to the
 * columns reviewers filter on.
 */
public final class JdbcAmbiguousTransactionStore implements AmbiguousTransactionStore {
  private final ConnectionProvider connectionProvider;
  private final TableNames tables;
  private final JsonCodec jsonCodec;

  public JdbcAmbiguousTransactionStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.defaults(), JsonCodec.getDefault());
  }

  public JdbcAmbiguousTransactionStore(ConnectionProvider connectionProvider, TableNames tables,
      JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void write(List<Map<String, String>> rows) {
    Objects.requireNonNull(rows, "rows");
    String table = tables.ambiguousTransactions();
    String sql = "INSERT INTO " + table
        + " (source_row, email, candidates, row_data) VALUES (?,?,?,?)";
    List<Object[]> params = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) {
      params.add(new Object[]{sourceRow(row.get(AmbiguousTransaction.ROW)), row.get(AmbiguousTransaction.EMAIL),
          row.get(AmbiguousTransaction.CANDIDATES), jsonCodec.toJson(row)});
    }
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, "DELETE FROM " + table);
      return JdbcTemplate.batchUpdate(conn, sql, params);
    });
  }

  /** Loads the stored review rows, oldest first. */
  public List<Map<String, String>> readAll() {
    String sql = "SELECT row_data FROM " + tables.ambiguousTransactions() + " ORDER BY seq";
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, rs -> jsonCodec.parseObject(rs.getString("row_data"))));
  }

  private static Integer sourceRow(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Row must be a number, got: " + value, e);
    }
  }
}
