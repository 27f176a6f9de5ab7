package membership.schedule;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class MembershipDatesTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

  @Test
  void earlyRenewalKeepsRemainingTime() {
    LocalDate expires = TODAY.plusDays(10);
    assertEquals(LocalDate.of(2026, 6, 25), MembershipDates.calculateExpirationDate(TODAY, expires, 1));
  }

  @Test
  void lateRenewalStartsFromToday() {
    LocalDate expires = TODAY.minusDays(30);
    assertEquals(LocalDate.of(2027, 6, 15), MembershipDates.calculateExpirationDate(TODAY, expires, 2));
  }

  @Test
  void unknownExpiryStartsFromReference() {
    assertEquals(LocalDate.of(2026, 6, 15), MembershipDates.calculateExpirationDate(TODAY, null, 1));
  }

  @Test
  void addYearsClampsLeapDay() {
    assertEquals(LocalDate.of(2025, 2, 28), MembershipDates.addYears(LocalDate.of(2024, 2, 29), 1));
  }

  @Test
  void addDaysAcceptsNegativeOffsets() {
    assertEquals(LocalDate.of(2025, 6, 5), MembershipDates.addDays(TODAY, -10));
  }
}
