package membership.identity;

import java.util.Locale;

/**
 * Normalization rules for the identity keys used to match people.
 */
public final class IdentityKeys {

  private IdentityKeys() {}

  /** Trimmed, lowercased email; empty for {@code null}. */
  public static String email(String email) {
    return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
  }

  /** Trimmed phone; empty for {@code null}. */
  public static String phone(String phone) {
    return phone == null ? "" : phone.trim();
  }

  /** First and last name concatenated, lowercased, letters only. */
  public static String name(String first, String last) {
    String joined = (first == null ? "" : first) + (last == null ? "" : last);
    StringBuilder sb = new StringBuilder(joined.length());
    for (int i = 0; i < joined.length(); i++) {
      char c = joined.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(Character.toLowerCase(c));
      }
    }
    return sb.toString();
  }
}
