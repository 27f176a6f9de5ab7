package membership.jdbc;

import membership.model.ActionSpec;
import membership.model.ActionType;
import membership.model.FifoItem;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.MigratingMember;
import membership.model.ScheduleEntry;
import membership.model.Transaction;
import membership.spi.ConnectionProvider;
import membership.spi.MembershipStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MembershipStore} over relational tables.
 *
 * <p>Each sheet is a table keyed by {@code row_no}, the row's position in the sheet.
 * Loads return rows in {@code row_no} order; saves replace the whole table in one
 * transaction, so readers never observe a half-written sheet.
 *
 * @see TableNames
 */
public final class JdbcMembershipStore implements MembershipStore {
  private static final Logger logger = Logger.getLogger(JdbcMembershipStore.class.getName());

  private static final String MEMBER_COLUMNS = "email, first_name, last_name, phone, joined, expires, "
      + "period_years, renewed_on, status, directory_share_name, directory_share_email, "
      + "directory_share_phone, migrated";
  private static final String TRANSACTION_COLUMNS = "email_address, first_name, last_name, phone, payment, "
      + "directory, payable_status, processed";
  private static final String SCHEDULE_COLUMNS = "email, action_type, due_date";
  private static final String MIGRATOR_COLUMNS = "email, first_name, last_name, phone, joined, period_years, "
      + "expires, renewed_on, directory, status, migrate_me, migrated, group_emails";

  private static final JdbcTemplate.RowMapper<Member> MEMBER_ROW_MAPPER = rs -> new Member(
      rs.getString("email"),
      rs.getString("first_name"),
      rs.getString("last_name"),
      rs.getString("phone"),
      JdbcTemplate.getDate(rs, "joined"),
      JdbcTemplate.getDate(rs, "expires"),
      rs.getInt("period_years"),
      JdbcTemplate.getDate(rs, "renewed_on"),
      MemberStatus.fromLabel(rs.getString("status")),
      rs.getBoolean("directory_share_name"),
      rs.getBoolean("directory_share_email"),
      rs.getBoolean("directory_share_phone"),
      JdbcTemplate.getDate(rs, "migrated"));

  private static final JdbcTemplate.RowMapper<Transaction> TRANSACTION_ROW_MAPPER = rs -> new Transaction(
      rs.getString("email_address"),
      rs.getString("first_name"),
      rs.getString("last_name"),
      rs.getString("phone"),
      rs.getString("payment"),
      rs.getString("directory"),
      rs.getString("payable_status"),
      JdbcTemplate.getDate(rs, "processed"));

  private static final JdbcTemplate.RowMapper<ScheduleEntry> SCHEDULE_ROW_MAPPER = rs -> new ScheduleEntry(
      rs.getString("email"),
      ActionType.fromLabel(rs.getString("action_type")),
      JdbcTemplate.getDate(rs, "due_date"));

  private static final JdbcTemplate.RowMapper<MigratingMember> MIGRATOR_ROW_MAPPER = rs -> {
    String status = rs.getString("status");
    return new MigratingMember(
        rs.getString("email"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("phone"),
        JdbcTemplate.getDate(rs, "joined"),
        rs.getInt("period_years"),
        JdbcTemplate.getDate(rs, "expires"),
        JdbcTemplate.getDate(rs, "renewed_on"),
        rs.getBoolean("directory"),
        status == null || status.isBlank() ? null : MemberStatus.fromLabel(status),
        rs.getBoolean("migrate_me"),
        JdbcTemplate.getDate(rs, "migrated"),
        FifoItem.parseGroups(rs.getString("group_emails")));
  };

  private static final JdbcTemplate.RowMapper<ActionSpec> ACTION_SPEC_ROW_MAPPER = rs -> new ActionSpec(
      ActionType.fromLabel(rs.getString("action_type")),
      rs.getString("subject"),
      rs.getString("body"),
      JdbcTemplate.getInteger(rs, "offset_days"));

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;

  public JdbcMembershipStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.defaults());
  }

  public JdbcMembershipStore(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public List<Member> loadMembers() {
    return load(tables.members(), MEMBER_COLUMNS, MEMBER_ROW_MAPPER);
  }

  @Override
  public void saveMembers(List<Member> members) {
    List<Object[]> rows = new ArrayList<>(members.size());
    for (Member m : members) {
      rows.add(new Object[]{m.email(), m.first(), m.last(), m.phone(), m.joined(), m.expires(), m.period(),
          m.renewedOn(), m.status().label(), m.directoryShareName(), m.directoryShareEmail(),
          m.directorySharePhone(), m.migrated()});
    }
    replace(tables.members(), MEMBER_COLUMNS, 13, rows);
  }

  @Override
  public List<Transaction> loadTransactions() {
    return load(tables.transactions(), TRANSACTION_COLUMNS, TRANSACTION_ROW_MAPPER);
  }

  @Override
  public void saveTransactions(List<Transaction> transactions) {
    List<Object[]> rows = new ArrayList<>(transactions.size());
    for (Transaction t : transactions) {
      rows.add(new Object[]{t.emailAddress(), t.firstName(), t.lastName(), t.phone(), t.payment(),
          t.directory(), t.payableStatus(), t.processed()});
    }
    replace(tables.transactions(), TRANSACTION_COLUMNS, 8, rows);
  }

  @Override
  public List<ScheduleEntry> loadSchedule() {
    return load(tables.schedule(), SCHEDULE_COLUMNS, SCHEDULE_ROW_MAPPER);
  }

  @Override
  public void saveSchedule(List<ScheduleEntry> schedule) {
    List<Object[]> rows = new ArrayList<>(schedule.size());
    for (ScheduleEntry e : schedule) {
      rows.add(new Object[]{e.email(), e.type().label(), e.date()});
    }
    replace(tables.schedule(), SCHEDULE_COLUMNS, 3, rows);
  }

  @Override
  public List<MigratingMember> loadMigrators() {
    return load(tables.migrators(), MIGRATOR_COLUMNS, MIGRATOR_ROW_MAPPER);
  }

  @Override
  public void saveMigrators(List<MigratingMember> migrators) {
    List<Object[]> rows = new ArrayList<>(migrators.size());
    for (MigratingMember m : migrators) {
      rows.add(new Object[]{m.email(), m.first(), m.last(), m.phone(), m.joined(), m.period(), m.expires(),
          m.renewedOn(), m.directory(), m.status().label(), m.migrateMe(), m.migrated(),
          String.join(",", m.groups())});
    }
    replace(tables.migrators(), MIGRATOR_COLUMNS, 13, rows);
  }

  @Override
  public List<ActionSpec> loadActionSpecs() {
    String sql = "SELECT action_type, subject, body, offset_days FROM " + tables.actionSpecs();
    return JdbcTemplate.withConnection(connectionProvider,
        conn -> JdbcTemplate.query(conn, sql, ACTION_SPEC_ROW_MAPPER));
  }

  /**
   * Replaces the configured action specs. Not part of {@link MembershipStore}; used to
   * seed a new installation.
   */
  public void saveActionSpecs(List<ActionSpec> specs) {
    List<Object[]> rows = new ArrayList<>(specs.size());
    for (ActionSpec spec : specs) {
      rows.add(new Object[]{spec.type().label(), spec.subject(), spec.body(), spec.offset()});
    }
    String table = tables.actionSpecs();
    JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, "DELETE FROM " + table);
      return JdbcTemplate.batchUpdate(conn,
          "INSERT INTO " + table + " (action_type, subject, body, offset_days) VALUES (?,?,?,?)", rows);
    });
  }

  private <T> List<T> load(String table, String columns, JdbcTemplate.RowMapper<T> mapper) {
    String sql = "SELECT " + columns + " FROM " + table + " ORDER BY row_no";
    return JdbcTemplate.withConnection(connectionProvider, conn -> JdbcTemplate.query(conn, sql, mapper));
  }

  private void replace(String table, String columns, int columnCount, List<Object[]> rows) {
    String sql = "INSERT INTO " + table + " (row_no, " + columns + ") VALUES (?"
        + ",?".repeat(columnCount) + ")";
    List<Object[]> numbered = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Object[] row = rows.get(i);
      Object[] withRowNo = new Object[row.length + 1];
      withRowNo[0] = i;
      System.arraycopy(row, 0, withRowNo, 1, row.length);
      numbered.add(withRowNo);
    }
    int written = JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, "DELETE FROM " + table);
      return JdbcTemplate.batchUpdate(conn, sql, numbered);
    });
    logger.log(Level.FINE, "Replaced {0} with {1} rows", new Object[]{table, written});
  }
}
