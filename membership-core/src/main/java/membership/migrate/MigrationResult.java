package membership.migrate;

import membership.model.Member;
import membership.model.MigratingMember;
import membership.model.Notification;
import membership.model.RowError;
import membership.model.ScheduleEntry;

import java.util.List;

/**
 * Output of one migration run.
 *
 * @param migrators     import rows, with migrated ones stamped
 * @param members       member sheet with imported rows appended
 * @param schedule      expiry schedule with entries for imported active members
 * @param notifications migration messages that were sent
 * @param migrated      number of rows imported
 * @param errors        per-row failures
 */
public record MigrationResult(
    List<MigratingMember> migrators,
    List<Member> members,
    List<ScheduleEntry> schedule,
    List<Notification> notifications,
    int migrated,
    List<RowError> errors) {

  public MigrationResult {
    migrators = List.copyOf(migrators);
    members = List.copyOf(members);
    schedule = List.copyOf(schedule);
    notifications = List.copyOf(notifications);
    errors = List.copyOf(errors);
  }
}
