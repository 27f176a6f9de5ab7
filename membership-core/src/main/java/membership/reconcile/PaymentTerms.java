package membership.reconcile;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the membership term out of a payment description such as
 * {@code "2 years - $50"}.
 */
public final class PaymentTerms {
  private static final Pattern YEARS = Pattern.compile("(\\d+)\\s*year", Pattern.CASE_INSENSITIVE);

  /** Term used when the payment text names none. */
  public static final int DEFAULT_PERIOD = 1;

  private PaymentTerms() {}

  /**
   * Returns the number of years named in the payment text, or {@link #DEFAULT_PERIOD}.
   */
  public static int periodOf(String payment) {
    if (payment == null) {
      return DEFAULT_PERIOD;
    }
    Matcher matcher = YEARS.matcher(payment);
    if (!matcher.find()) {
      return DEFAULT_PERIOD;
    }
    try {
      int years = Integer.parseInt(matcher.group(1));
      return years > 0 ? years : DEFAULT_PERIOD;
    } catch (NumberFormatException e) {
      return DEFAULT_PERIOD;
    }
  }
}
