package membership.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void defaultsUseMembershipPrefix() {
    TableNames tables = TableNames.defaults();

    assertEquals("membership_member", tables.members());
    assertEquals("membership_expiry_queue", tables.expiryQueue());
    assertEquals("membership_audit_log", tables.auditLog());
  }

  @Test
  void customPrefix() {
    assertEquals("club_schedule", TableNames.withPrefix("club_").schedule());
  }

  @Test
  void rejectsUnsafeNames() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("x; DROP TABLE y; --"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1abc"));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertEquals("ok_name", TableNames.validate("ok_name"));
  }
}
