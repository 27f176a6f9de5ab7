package membership.identity;

import membership.model.Member;
import membership.model.Transaction;

/**
 * Normalized identity characteristics of a person to look up.
 */
public record IdentityQuery(String email, String phone, String nameKey) {

  public IdentityQuery {
    email = IdentityKeys.email(email);
    phone = IdentityKeys.phone(phone);
    nameKey = nameKey == null ? "" : nameKey;
  }

  public static IdentityQuery of(String email, String phone, String first, String last) {
    return new IdentityQuery(email, phone, IdentityKeys.name(first, last));
  }

  public static IdentityQuery of(Transaction txn) {
    return of(txn.emailAddress(), txn.phone(), txn.firstName(), txn.lastName());
  }

  public static IdentityQuery of(Member member) {
    return of(member.email(), member.phone(), member.first(), member.last());
  }
}
