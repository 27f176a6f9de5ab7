package membership.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FifoItemTest {

  private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

  private static FifoItem item(String nextAttemptAt, boolean dead) {
    return new FifoItem("01J", "a@x.com", "S", "B", List.of("g@x.com"), 0, "", "", nextAttemptAt, null, dead);
  }

  @Test
  void validatesFields() {
    assertThrows(IllegalArgumentException.class,
        () -> new FifoItem(" ", "a@x.com", "", "", null, 0, null, null, null, null, false));
    assertThrows(IllegalArgumentException.class,
        () -> new FifoItem("1", "not an email", "", "", null, 0, null, null, null, null, false));
    assertThrows(IllegalArgumentException.class,
        () -> new FifoItem("1", "a@x.com", "", "", null, -1, null, null, null, null, false));
    assertThrows(IllegalArgumentException.class,
        () -> new FifoItem("1", "a@x.com", "", "", null, 0, null, null, null, 0, false));
    assertThrows(NullPointerException.class,
        () -> new FifoItem(null, "a@x.com", "", "", null, 0, null, null, null, null, false));
  }

  @Test
  void eligibility() {
    assertTrue(item("", false).isEligibleAt(NOW));
    assertTrue(item("garbage", false).isEligibleAt(NOW));
    assertTrue(item("2025-06-15T11:59:59Z", false).isEligibleAt(NOW));
    assertFalse(item("2025-06-15T12:00:01Z", false).isEligibleAt(NOW));
    assertFalse(item("", true).isEligibleAt(NOW));
  }

  @Test
  void withFailureIncrementsAttempts() {
    FifoItem failed = item("", false).withFailure(NOW, "boom", NOW.plusSeconds(60), false);

    assertEquals(1, failed.attempts());
    assertEquals("2025-06-15T12:00:00Z", failed.lastAttemptAt());
    assertEquals("boom", failed.lastError());
    assertEquals("2025-06-15T12:01:00Z", failed.nextAttemptAt());

    FifoItem dead = failed.withFailure(NOW, "boom again", null, true);
    assertEquals(2, dead.attempts());
    assertEquals("", dead.nextAttemptAt());
    assertTrue(dead.dead());
  }

  @Test
  void groupsParseFromCommaList() {
    assertEquals(List.of("a@x.com", "b@x.com"), FifoItem.parseGroups(" a@x.com, ,b@x.com "));
    assertEquals(List.of(), FifoItem.parseGroups(""));
    assertEquals("g@x.com", item("", false).groupsAsString());
  }

  @Test
  void withoutMessageClearsSubjectAndBody() {
    FifoItem sent = item("", false).withoutMessage();

    assertFalse(sent.hasMessage());
    assertEquals(List.of("g@x.com"), sent.groups());
  }
}
