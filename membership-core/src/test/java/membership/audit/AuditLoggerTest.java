package membership.audit;

import membership.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

  private final AuditLogger auditLogger = new AuditLogger(Fixtures.CLOCK);

  @Test
  void successEntryIsStampedAndSerialized() {
    Map<String, String> data = new LinkedHashMap<>();
    data.put("joined", "2");
    data.put("renewed", "1");

    AuditLogEntry entry = auditLogger.success("Transaction", "Processed transactions", data);

    assertEquals(Fixtures.NOW, entry.timestamp());
    assertEquals("Transaction", entry.type());
    assertEquals(AuditOutcome.SUCCESS, entry.outcome());
    assertEquals("Processed transactions", entry.note());
    assertEquals("", entry.error());
    assertEquals("{\"joined\":\"2\",\"renewed\":\"1\"}", entry.json());
  }

  @Test
  void failureEntryCarriesError() {
    AuditLogEntry entry = auditLogger.failure("Transaction", "Row 3", "mail down", null);

    assertEquals(AuditOutcome.FAIL, entry.outcome());
    assertEquals("mail down", entry.error());
    assertEquals("{}", entry.json());
  }

  @Test
  void blankTypeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> auditLogger.createLogEntry(" ", AuditOutcome.SUCCESS, null, null, null));
    assertThrows(IllegalArgumentException.class,
        () -> auditLogger.createLogEntry(null, AuditOutcome.SUCCESS, null, null, null));
  }

  @Test
  void outcomeLabels() {
    assertEquals("success", AuditOutcome.SUCCESS.label());
    assertEquals(AuditOutcome.FAIL, AuditOutcome.fromLabel(" Fail "));
    assertThrows(IllegalArgumentException.class, () -> AuditOutcome.fromLabel("maybe"));
  }
}
