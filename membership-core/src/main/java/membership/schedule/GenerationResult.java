package membership.schedule;

import membership.model.ExpiryNotification;
import membership.model.Member;
import membership.model.ScheduleEntry;

import java.util.List;

/**
 * Output of one notification generator run.
 *
 * @param members        member rows, with terminal reminders applied
 * @param schedule       remaining schedule entries
 * @param notifications  payloads to enqueue, in consumption order
 * @param processedCount due entries consumed, including skipped ones
 */
public record GenerationResult(
    List<Member> members,
    List<ScheduleEntry> schedule,
    List<ExpiryNotification> notifications,
    int processedCount) {

  public GenerationResult {
    members = List.copyOf(members);
    schedule = List.copyOf(schedule);
    notifications = List.copyOf(notifications);
  }
}
