package membership.jdbc;

import membership.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in the store implementations.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Work run on a connection; used by {@link #inTransaction} and {@link #withConnection}. */
  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new MembershipStoreException("Failed to execute update", e);
    }
  }

  /** Execute one INSERT or UPDATE per parameter row as a JDBC batch. */
  public static int batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return 0;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] row : rows) {
        bindParams(ps, row);
        ps.addBatch();
      }
      int total = 0;
      for (int count : ps.executeBatch()) {
        total += Math.max(count, 0);
      }
      return total;
    } catch (SQLException e) {
      throw new MembershipStoreException("Failed to execute batch update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new MembershipStoreException("Failed to execute query", e);
    }
  }

  /**
   * Runs {@code callback} on a fresh connection with auto-commit disabled, committing
   * on success and rolling back on any failure.
   */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = callback.doInConnection(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new MembershipStoreException("Transaction failed", e);
    }
  }

  /** Runs {@code callback} on a fresh connection in auto-commit mode. */
  public static <T> T withConnection(ConnectionProvider connectionProvider, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new MembershipStoreException("Failed to obtain connection", e);
    }
  }

  /** Reads a nullable DATE column. */
  public static LocalDate getDate(ResultSet rs, String column) throws SQLException {
    Date date = rs.getDate(column);
    return date == null ? null : date.toLocalDate();
  }

  /** Reads a nullable INT column. */
  public static Integer getInteger(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof LocalDate d) {
        ps.setDate(i + 1, Date.valueOf(d));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
