package membership.schedule;

import membership.identity.IdentityKeys;
import membership.model.ActionSpecs;
import membership.model.ActionType;
import membership.model.Member;
import membership.model.ScheduleEntry;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the expiry reminder schedule from members' expiry dates.
 *
 * <p>A member's schedule is always the forward-looking subset of the four expiry
 * reminders: entries dated today or earlier are never created. All methods return
 * new lists and leave their inputs untouched.
 */
public final class ExpiryScheduler {
  private final ActionSpecs actionSpecs;

  public ExpiryScheduler(ActionSpecs actionSpecs) {
    this.actionSpecs = Objects.requireNonNull(actionSpecs, "actionSpecs");
  }

  /**
   * Creates the reminders for one expiry date, in {@code Expiry1..Expiry4} order.
   * Types with no configured offset are skipped.
   *
   * @param email   member email
   * @param expires member expiry date
   * @param today   the run date; only entries dated after it are returned
   * @return the future entries
   */
  public List<ScheduleEntry> scheduleEntriesFor(String email, LocalDate expires, LocalDate today) {
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(today, "today");
    List<ScheduleEntry> entries = new ArrayList<>();
    if (expires == null) {
      return entries;
    }
    for (ActionType type : ActionType.EXPIRIES) {
      Optional<Integer> offset = actionSpecs.offset(type);
      if (offset.isEmpty()) {
        continue;
      }
      LocalDate date = MembershipDates.addDays(expires, offset.get());
      if (date.isAfter(today)) {
        entries.add(new ScheduleEntry(email, type, date));
      }
    }
    return entries;
  }

  /**
   * Returns {@code schedule} without any entry for {@code email}. Emails match
   * ignoring case and surrounding whitespace.
   */
  public List<ScheduleEntry> removeScheduleFor(String email, List<ScheduleEntry> schedule) {
    Objects.requireNonNull(schedule, "schedule");
    String key = IdentityKeys.email(email);
    List<ScheduleEntry> remaining = new ArrayList<>(schedule.size());
    for (ScheduleEntry entry : schedule) {
      if (!IdentityKeys.email(entry.email()).equals(key)) {
        remaining.add(entry);
      }
    }
    return remaining;
  }

  /**
   * Replaces the member's entries with ones derived from its current expiry date.
   */
  public List<ScheduleEntry> addRenewedMemberToSchedule(Member member, List<ScheduleEntry> schedule,
      LocalDate today) {
    List<ScheduleEntry> updated = removeScheduleFor(member.email(), schedule);
    updated.addAll(scheduleEntriesFor(member.email(), member.expires(), today));
    return updated;
  }
}
