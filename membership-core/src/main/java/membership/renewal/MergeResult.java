package membership.renewal;

import membership.model.Member;
import membership.model.ScheduleEntry;

import java.util.List;

/**
 * Outcome of merging a join into a renewal.
 *
 * <p>On failure {@code members} and {@code schedule} are the unchanged inputs and
 * {@code message} says why.
 */
public record MergeResult(boolean success, String message, List<Member> members, List<ScheduleEntry> schedule) {

  public MergeResult {
    message = message == null ? "" : message;
    members = List.copyOf(members);
    schedule = List.copyOf(schedule);
  }

  static MergeResult rejected(String message, List<Member> members, List<ScheduleEntry> schedule) {
    return new MergeResult(false, message, members, schedule);
  }
}
