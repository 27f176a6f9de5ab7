package membership.schedule;

import membership.identity.IdentityKeys;
import membership.model.ActionSpec;
import membership.model.ActionSpecs;
import membership.model.ExpiryNotification;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.ScheduleEntry;
import membership.util.TemplateExpander;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns due schedule entries into expiry notification payloads.
 *
 * <p>Entries are ordered by date descending, then type name ascending, and the due
 * ones are consumed from the end of that order, so the earliest date goes first. Only
 * one reminder per email is honored per run. The terminal reminder expires the
 * member and lists every configured group for removal. No email is sent and no group
 * is touched here; the payloads go to the expiry queue.
 */
public final class NotificationGenerator {
  private static final Logger logger = Logger.getLogger(NotificationGenerator.class.getName());

  private static final Comparator<ScheduleEntry> SCHEDULE_ORDER =
      Comparator.comparing(ScheduleEntry::date).reversed()
          .thenComparing(entry -> entry.type().label());

  private final ActionSpecs actionSpecs;
  private final List<String> groups;
  private final Clock clock;

  /**
   * @param actionSpecs message templates for the expiry types
   * @param groups      addresses of the groups an expired member is removed from
   * @param clock       source of the run date
   */
  public NotificationGenerator(ActionSpecs actionSpecs, List<String> groups, Clock clock) {
    this.actionSpecs = Objects.requireNonNull(actionSpecs, "actionSpecs");
    this.groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public GenerationResult generate(List<Member> members, List<ScheduleEntry> schedule) {
    Objects.requireNonNull(members, "members");
    Objects.requireNonNull(schedule, "schedule");
    LocalDate today = LocalDate.now(clock);

    List<Member> updatedMembers = new ArrayList<>(members);
    List<ScheduleEntry> remaining = new ArrayList<>(schedule);
    remaining.sort(SCHEDULE_ORDER);

    int dueCount = 0;
    while (dueCount < remaining.size() && !remaining.get(remaining.size() - 1 - dueCount).date().isAfter(today)) {
      dueCount++;
    }

    List<ExpiryNotification> notifications = new ArrayList<>();
    Set<String> emailsSeen = new HashSet<>();
    Set<String> expiredEmails = new HashSet<>();
    for (int n = 0; n < dueCount; n++) {
      ScheduleEntry entry = remaining.remove(remaining.size() - 1);
      String email = entry.email();
      if (!emailsSeen.add(IdentityKeys.email(email))) {
        logger.log(Level.WARNING, "Skipping {0} for {1} - already processed",
            new Object[]{email, entry.type().label()});
        continue;
      }
      int memberIndex = findActiveMember(updatedMembers, email);
      if (memberIndex < 0) {
        logger.log(Level.WARNING, "Skipping member {0} - they''re not an active member", email);
        continue;
      }
      Member member = updatedMembers.get(memberIndex);
      List<String> removals = List.of();
      if (entry.type().isTerminal()) {
        member = member.toBuilder().status(MemberStatus.EXPIRED).build();
        updatedMembers.set(memberIndex, member);
        expiredEmails.add(IdentityKeys.email(email));
        removals = groups;
      }
      ActionSpec spec = actionSpecs.require(entry.type());
      notifications.add(new ExpiryNotification(member.email(),
          TemplateExpander.expand(spec.subject(), member.toFields()),
          TemplateExpander.expand(spec.body(), member.toFields()),
          removals));
      logger.log(Level.INFO, "Generated {0} notification for {1}",
          new Object[]{entry.type().label(), email});
    }

    remaining.removeIf(entry -> expiredEmails.contains(IdentityKeys.email(entry.email())));
    return new GenerationResult(updatedMembers, remaining, notifications, dueCount);
  }

  private static int findActiveMember(List<Member> members, String email) {
    String key = IdentityKeys.email(email);
    for (int i = 0; i < members.size(); i++) {
      Member member = members.get(i);
      if (member.status() != MemberStatus.EXPIRED && IdentityKeys.email(member.email()).equals(key)) {
        return i;
      }
    }
    return -1;
  }
}
