package membership.schedule;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Date arithmetic for membership terms.
 */
public final class MembershipDates {

  private MembershipDates() {}

  public static LocalDate addDays(LocalDate date, int days) {
    return Objects.requireNonNull(date, "date").plusDays(days);
  }

  public static LocalDate addYears(LocalDate date, int years) {
    return Objects.requireNonNull(date, "date").plusYears(years);
  }

  /**
   * Computes a renewed expiry date. The new term starts from whichever is later, the
   * reference date or the current expiry, so renewing early keeps the remaining time
   * and renewing late does not grant it back.
   *
   * @param reference the renewal date, usually today
   * @param expires   the current expiry, or {@code null} if unknown
   * @param period    term length in years
   * @return the new expiry date
   */
  public static LocalDate calculateExpirationDate(LocalDate reference, LocalDate expires, int period) {
    Objects.requireNonNull(reference, "reference");
    LocalDate start = expires != null && expires.isAfter(reference) ? expires : reference;
    return start.plusYears(period);
  }
}
