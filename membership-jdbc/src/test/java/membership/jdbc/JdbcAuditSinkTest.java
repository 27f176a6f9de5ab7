package membership.jdbc;

import membership.audit.AuditLogEntry;
import membership.audit.AuditLogger;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditSinkTest {

  private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcAuditSink sink;
  private final AuditLogger auditLogger = new AuditLogger(Clock.fixed(NOW, ZoneOffset.UTC));

  @BeforeEach
  void setUp() throws Exception {
    dataSource = H2Schema.newDataSource();
    sink = new JdbcAuditSink(dataSource::getConnection);
  }

  @Test
  void persistsEntriesInOrder() throws Exception {
    AuditLogEntry ok = auditLogger.success("Transaction", "Processed 1 joins", Map.of("joined", "1"));
    AuditLogEntry failed = auditLogger.failure("DeadLetter", "abandoned", "smtp down", null);

    sink.persist(List.of(ok, failed));

    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery(
             "SELECT logged_at, entry_type, outcome, error, json_data FROM membership_audit_log ORDER BY seq")) {
      assertTrue(rs.next());
      assertEquals(NOW, rs.getTimestamp("logged_at").toInstant());
      assertEquals("Transaction", rs.getString("entry_type"));
      assertEquals("success", rs.getString("outcome"));
      assertEquals("{\"joined\":\"1\"}", rs.getString("json_data"));
      assertTrue(rs.next());
      assertEquals("fail", rs.getString("outcome"));
      assertEquals("smtp down", rs.getString("error"));
      assertFalse(rs.next());
    }
  }

  @Test
  void emptyBatchIsNoOp() {
    assertDoesNotThrow(() -> sink.persist(List.of()));
  }
}
