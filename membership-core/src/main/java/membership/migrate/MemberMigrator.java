package membership.migrate;

import membership.identity.IdentityKeys;
import membership.model.ActionSpec;
import membership.model.ActionSpecs;
import membership.model.ActionType;
import membership.model.Member;
import membership.model.MigratingMember;
import membership.model.Notification;
import membership.model.RowError;
import membership.model.ScheduleEntry;
import membership.schedule.ExpiryScheduler;
import membership.spi.GroupMembership;
import membership.spi.NotificationSender;
import membership.util.TemplateExpander;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Imports members from a legacy member list.
 *
 * <p>Rows flagged for migration that have not been migrated yet are appended to the
 * member sheet. Active rows are also subscribed to their legacy groups, scheduled for
 * expiry reminders and sent the {@code Migrate} message; inactive rows are imported
 * silently. Rows without an email, or whose email already belongs to an active
 * member, are skipped. A row is stamped {@code migrated} only when its import
 * succeeded; failures are collected and the batch continues.
 */
public final class MemberMigrator {
  private static final Logger logger = Logger.getLogger(MemberMigrator.class.getName());

  private final ActionSpecs actionSpecs;
  private final ExpiryScheduler scheduler;
  private final NotificationSender notificationSender;
  private final GroupMembership groupMembership;
  private final Clock clock;

  public MemberMigrator(ActionSpecs actionSpecs, NotificationSender notificationSender,
      GroupMembership groupMembership, Clock clock) {
    this.actionSpecs = Objects.requireNonNull(actionSpecs, "actionSpecs");
    this.notificationSender = Objects.requireNonNull(notificationSender, "notificationSender");
    this.groupMembership = Objects.requireNonNull(groupMembership, "groupMembership");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = new ExpiryScheduler(actionSpecs);
  }

  public MigrationResult migrate(List<MigratingMember> migrators, List<Member> members,
      List<ScheduleEntry> schedule) {
    Objects.requireNonNull(migrators, "migrators");
    Objects.requireNonNull(members, "members");
    Objects.requireNonNull(schedule, "schedule");
    LocalDate today = LocalDate.now(clock);

    List<MigratingMember> updatedMigrators = new ArrayList<>(migrators);
    List<Member> updatedMembers = new ArrayList<>(members);
    List<ScheduleEntry> updatedSchedule = new ArrayList<>(schedule);
    List<Notification> notifications = new ArrayList<>();
    List<RowError> errors = new ArrayList<>();
    Set<String> activeEmails = new HashSet<>();
    for (Member member : members) {
      if (member.isActive()) {
        activeEmails.add(IdentityKeys.email(member.email()));
      }
    }

    int migrated = 0;
    for (int i = 0; i < updatedMigrators.size(); i++) {
      MigratingMember row = updatedMigrators.get(i);
      int rowNumber = i + 2;
      if (row.email().isEmpty()) {
        logger.log(Level.INFO, "Skipping row {0}, no email address", rowNumber);
        continue;
      }
      if (activeEmails.contains(IdentityKeys.email(row.email()))) {
        logger.log(Level.INFO, "Skipping {0} on row {1}, already an active member",
            new Object[]{row.email(), rowNumber});
        continue;
      }
      if (!row.isPendingMigration()) {
        continue;
      }
      MigratingMember stamped = row.withMigrated(today);
      Member member = stamped.toMember();
      try {
        List<ScheduleEntry> entries = List.of();
        Notification notification = null;
        if (member.isActive()) {
          logger.log(Level.INFO, "Migrating active member {0}, row {1}",
              new Object[]{member.email(), rowNumber});
          for (String group : stamped.groups()) {
            groupMembership.addToGroup(member.email(), group);
          }
          entries = scheduler.scheduleEntriesFor(member.email(), member.expires(), today);
          ActionSpec spec = actionSpecs.require(ActionType.MIGRATE);
          notification = new Notification(member.email(),
              TemplateExpander.expand(spec.subject(), member.toFields()),
              TemplateExpander.expand(spec.body(), member.toFields()));
          notificationSender.send(notification);
          activeEmails.add(IdentityKeys.email(member.email()));
        } else {
          logger.log(Level.INFO, "Migrating inactive member {0}, row {1}; no groups joined or email sent",
              new Object[]{member.email(), rowNumber});
        }
        updatedMembers.add(member);
        updatedSchedule.addAll(entries);
        updatedMigrators.set(i, stamped);
        if (notification != null) {
          notifications.add(notification);
        }
        migrated++;
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to migrate row " + rowNumber, e);
        errors.add(new RowError(rowNumber, row.email(),
            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
      }
    }
    return new MigrationResult(updatedMigrators, updatedMembers, updatedSchedule, notifications,
        migrated, errors);
  }
}
