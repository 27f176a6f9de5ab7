package membership.schedule;

import membership.Fixtures;
import membership.model.ActionType;
import membership.model.ExpiryNotification;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.ScheduleEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static membership.Fixtures.GROUP_A;
import static membership.Fixtures.GROUP_B;
import static membership.Fixtures.TODAY;
import static membership.Fixtures.member;
import static org.junit.jupiter.api.Assertions.*;

class NotificationGeneratorTest {

  private final NotificationGenerator generator =
      new NotificationGenerator(Fixtures.specs(), List.of(GROUP_A, GROUP_B), Fixtures.CLOCK);

  private static Member ann() {
    return member("ann@x.com", "Ann", "Lee", "111", TODAY.minusYears(1), TODAY.plusDays(10));
  }

  @Test
  void dueEntryBecomesNotificationAndIsConsumed() {
    List<ScheduleEntry> schedule = List.of(
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY1, TODAY),
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY2, TODAY.plusDays(5)));

    GenerationResult result = generator.generate(List.of(ann()), schedule);

    assertEquals(1, result.processedCount());
    assertEquals(1, result.notifications().size());
    ExpiryNotification n = result.notifications().get(0);
    assertEquals("ann@x.com", n.email());
    assertEquals("Expiring soon", n.subject());
    assertEquals("<p>Ann, expires 6/25/2025</p>", n.htmlBody());
    assertTrue(n.groups().isEmpty());
    assertEquals(List.of(new ScheduleEntry("ann@x.com", ActionType.EXPIRY2, TODAY.plusDays(5))), result.schedule());
  }

  @Test
  void onlyEarliestEntryPerEmailIsHonored() {
    List<ScheduleEntry> schedule = List.of(
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY2, TODAY),
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY1, TODAY.minusDays(5)));

    GenerationResult result = generator.generate(List.of(ann()), schedule);

    assertEquals(2, result.processedCount());
    assertEquals(1, result.notifications().size());
    assertEquals("Expiring soon", result.notifications().get(0).subject());
    assertTrue(result.schedule().isEmpty());
  }

  @Test
  void sameDayEntriesConsumeHigherTypeFirst() {
    List<ScheduleEntry> schedule = List.of(
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY2, TODAY),
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY4, TODAY));

    GenerationResult result = generator.generate(List.of(ann()), schedule);

    assertEquals(1, result.notifications().size());
    assertEquals("Expired", result.notifications().get(0).subject());
  }

  @Test
  void terminalEntryExpiresMemberAndListsGroups() {
    List<ScheduleEntry> schedule = List.of(
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY4, TODAY.minusDays(1)),
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY1, TODAY.plusDays(30)),
        new ScheduleEntry("bob@x.com", ActionType.EXPIRY1, TODAY.plusDays(30)));

    GenerationResult result = generator.generate(List.of(ann()), schedule);

    assertEquals(MemberStatus.EXPIRED, result.members().get(0).status());
    ExpiryNotification n = result.notifications().get(0);
    assertEquals(List.of(GROUP_A, GROUP_B), n.groups());
    assertEquals("<p>Goodbye Ann</p>", n.htmlBody());
    assertEquals(List.of(new ScheduleEntry("bob@x.com", ActionType.EXPIRY1, TODAY.plusDays(30))), result.schedule());
  }

  @Test
  void inactiveOrUnknownMembersAreSkippedButConsumed() {
    Member expired = ann().toBuilder().status(MemberStatus.EXPIRED).build();
    List<ScheduleEntry> schedule = List.of(
        new ScheduleEntry("ann@x.com", ActionType.EXPIRY1, TODAY),
        new ScheduleEntry("ghost@x.com", ActionType.EXPIRY1, TODAY));

    GenerationResult result = generator.generate(List.of(expired), schedule);

    assertEquals(2, result.processedCount());
    assertTrue(result.notifications().isEmpty());
    assertTrue(result.schedule().isEmpty());
  }

  @Test
  void nothingDueLeavesEverythingInPlace() {
    List<ScheduleEntry> schedule = List.of(new ScheduleEntry("ann@x.com", ActionType.EXPIRY1, TODAY.plusDays(1)));

    GenerationResult result = generator.generate(List.of(ann()), schedule);

    assertEquals(0, result.processedCount());
    assertEquals(schedule, result.schedule());
    assertEquals(List.of(ann()), result.members());
  }
}
