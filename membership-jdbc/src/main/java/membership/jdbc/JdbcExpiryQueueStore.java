package membership.jdbc;

import membership.model.FifoItem;
import membership.spi.ConnectionProvider;
import membership.spi.ExpiryQueueStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ExpiryQueueStore} over the expiry queue and dead letter tables.
 *
 * <p>The queue table is rewritten on every save, keyed by queue position. Null slots
 * in a saved queue are not stored. Dead letters are append-only.
 */
public final class JdbcExpiryQueueStore implements ExpiryQueueStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final String ITEM_COLUMNS = "item_id, email, subject, html_body, group_emails, attempts, "
      + "last_attempt_at, last_error, next_attempt_at, max_attempts, dead";
  private static final String ITEM_PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?";

  private static final JdbcTemplate.RowMapper<FifoItem> ITEM_ROW_MAPPER = rs -> new FifoItem(
      rs.getString("item_id"),
      rs.getString("email"),
      rs.getString("subject"),
      rs.getString("html_body"),
      FifoItem.parseGroups(rs.getString("group_emails")),
      rs.getInt("attempts"),
      rs.getString("last_attempt_at"),
      rs.getString("last_error"),
      rs.getString("next_attempt_at"),
      JdbcTemplate.getInteger(rs, "max_attempts"),
      rs.getBoolean("dead"));

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;

  public JdbcExpiryQueueStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.defaults());
  }

  public JdbcExpiryQueueStore(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public List<FifoItem> loadQueue() {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tables.expiryQueue() + " ORDER BY row_no";
    return JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER));
  }

  @Override
  public void saveQueue(List<FifoItem> queue) {
    Objects.requireNonNull(queue, "queue");
    String table = tables.expiryQueue();
    String sql = "INSERT INTO " + table + " (row_no, " + ITEM_COLUMNS + ") VALUES (?," + ITEM_PLACEHOLDERS + ")";
    List<Object[]> rows = new ArrayList<>(queue.size());
    int rowNo = 0;
    for (FifoItem item : queue) {
      if (item == null) {
        continue;
      }
      Object[] values = itemValues(item);
      Object[] row = new Object[values.length + 1];
      row[0] = rowNo++;
      System.arraycopy(values, 0, row, 1, values.length);
      rows.add(row);
    }
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, "DELETE FROM " + table);
      return JdbcTemplate.batchUpdate(conn, sql, rows);
    });
  }

  @Override
  public void appendDeadLetters(List<FifoItem> items) {
    Objects.requireNonNull(items, "items");
    if (items.isEmpty()) {
      return;
    }
    String sql = "INSERT INTO " + tables.deadLetters() + " (" + ITEM_COLUMNS + ") VALUES (" + ITEM_PLACEHOLDERS + ")";
    List<Object[]> rows = new ArrayList<>(items.size());
    for (FifoItem item : items) {
      rows.add(itemValues(item));
    }
    JdbcTemplate.inTransaction(connectionProvider, conn -> JdbcTemplate.batchUpdate(conn, sql, rows));
  }

  @Override
  public List<FifoItem> loadDeadLetters() {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tables.deadLetters() + " ORDER BY seq";
    return JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER));
  }

  private static Object[] itemValues(FifoItem item) {
    return new Object[]{item.id(), item.email(), item.subject(), item.htmlBody(), item.groupsAsString(),
        item.attempts(), item.lastAttemptAt(), truncateError(item.lastError()), item.nextAttemptAt(),
        item.maxAttempts(), item.dead()};
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
