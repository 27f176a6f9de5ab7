package membership.identity;

import membership.model.Member;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lookup of active member rows by normalized email and phone.
 *
 * <p>Built fresh for each run from the current member list via {@link #of(List)}.
 * Only {@link membership.model.MemberStatus#ACTIVE} rows are indexed and blank keys
 * are never indexed. Rows appended during a run can be added with {@link #register}.
 */
public final class IdentityIndex {
  private final MultiMap<String, Integer> byEmail = new MultiMap<>();
  private final MultiMap<String, Integer> byPhone = new MultiMap<>();
  private final Map<Integer, String> nameKeys = new HashMap<>();

  private IdentityIndex() {}

  /**
   * Indexes the active rows of {@code members}; values are row indices.
   *
   * @param members the member sheet
   * @return a new index
   */
  public static IdentityIndex of(List<Member> members) {
    Objects.requireNonNull(members, "members");
    IdentityIndex index = new IdentityIndex();
    for (int i = 0; i < members.size(); i++) {
      index.register(i, members.get(i));
    }
    return index;
  }

  /**
   * Adds one row to the index. Inactive rows are ignored.
   *
   * @param rowIndex the row's index in the member list
   * @param member   the row
   */
  public void register(int rowIndex, Member member) {
    if (member == null || !member.isActive()) {
      return;
    }
    IdentityQuery keys = IdentityQuery.of(member);
    if (!keys.email().isEmpty()) {
      byEmail.add(keys.email(), rowIndex);
    }
    if (!keys.phone().isEmpty()) {
      byPhone.add(keys.phone(), rowIndex);
    }
    nameKeys.put(rowIndex, keys.nameKey());
  }

  /** Row indices of active members with this normalized email. */
  public Set<Integer> byEmail(String email) {
    String key = IdentityKeys.email(email);
    return key.isEmpty() ? Set.of() : byEmail.get(key);
  }

  /** Row indices of active members with this normalized phone. */
  public Set<Integer> byPhone(String phone) {
    String key = IdentityKeys.phone(phone);
    return key.isEmpty() ? Set.of() : byPhone.get(key);
  }

  /** Name key of an indexed row, or the empty string. */
  public String nameKey(int rowIndex) {
    return nameKeys.getOrDefault(rowIndex, "");
  }
}
