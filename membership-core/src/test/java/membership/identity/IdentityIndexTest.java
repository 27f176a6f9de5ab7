package membership.identity;

import membership.model.Member;
import membership.model.MemberStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static membership.Fixtures.TODAY;
import static membership.Fixtures.member;
import static org.junit.jupiter.api.Assertions.*;

class IdentityIndexTest {

  @Test
  void indexesActiveMembersByNormalizedEmailAndPhone() {
    List<Member> members = List.of(
        member(" Alice@Example.com ", "Alice", "Smith", " 555-1234 ", TODAY, TODAY.plusYears(1)),
        member("bob@example.com", "Bob", "Jones", "555-9999", TODAY, TODAY.plusYears(1)));

    IdentityIndex index = IdentityIndex.of(members);

    assertEquals(Set.of(0), index.byEmail("alice@example.com"));
    assertEquals(Set.of(0), index.byEmail("  ALICE@example.COM"));
    assertEquals(Set.of(0), index.byPhone("555-1234"));
    assertEquals(Set.of(1), index.byPhone(" 555-9999"));
  }

  @Test
  void skipsExpiredMembers() {
    Member expired = member("old@example.com", "Old", "Timer", "555-0000", TODAY.minusYears(2), TODAY.minusYears(1))
        .toBuilder().status(MemberStatus.EXPIRED).build();

    IdentityIndex index = IdentityIndex.of(List.of(expired));

    assertTrue(index.byEmail("old@example.com").isEmpty());
    assertTrue(index.byPhone("555-0000").isEmpty());
  }

  @Test
  void blankKeysAreNotIndexed() {
    List<Member> members = List.of(
        member("", "No", "Email", "", TODAY, TODAY.plusYears(1)),
        member("  ", "Also", "Blank", "  ", TODAY, TODAY.plusYears(1)));

    IdentityIndex index = IdentityIndex.of(members);

    assertTrue(index.byEmail("").isEmpty());
    assertTrue(index.byPhone("").isEmpty());
    assertTrue(index.byPhone(null).isEmpty());
  }

  @Test
  void registerAddsRowAppendedDuringRun() {
    IdentityIndex index = IdentityIndex.of(List.of());
    index.register(4, member("new@example.com", "New", "Person", "555-4444", TODAY, TODAY.plusYears(1)));

    assertEquals(Set.of(4), index.byEmail("new@example.com"));
    assertEquals("newperson", index.nameKey(4));
  }

  @Test
  void nameKeyKeepsLettersOnly() {
    assertEquals("maryannobrien", IdentityKeys.name("Mary-Ann", "O'Brien 3"));
    assertEquals("", IdentityKeys.name(null, null));
  }
}
