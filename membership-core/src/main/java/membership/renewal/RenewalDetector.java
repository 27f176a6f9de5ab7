package membership.renewal;

import membership.identity.IdentityQuery;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.ScheduleEntry;
import membership.schedule.ExpiryScheduler;
import membership.schedule.MembershipDates;
import membership.spi.GroupMembership;
import membership.spi.GroupMembership.GroupChangeResult;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds active member rows that are really one person re-joining before the earlier
 * term ran out, and merges such a pair into a single renewed row.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RenewalDetector {
  private static final Logger logger = Logger.getLogger(RenewalDetector.class.getName());

  static final int EMAIL_WEIGHT = 4;
  static final int PHONE_WEIGHT = 2;
  static final int NAME_WEIGHT = 1;

  private final ExpiryScheduler scheduler;
  private final Clock clock;
  private final GroupMembership groupMembership;

  private RenewalDetector(Builder builder) {
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.groupMembership = builder.groupMembership;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Scores how strongly two rows share an identity: 4 for the same email, 2 for the
   * same phone, 1 for the same name. Blank keys never match.
   *
   * @return a score from 0 (nothing shared) to 7 (all three shared)
   */
  public static int similarity(Member a, Member b) {
    IdentityQuery left = IdentityQuery.of(a);
    IdentityQuery right = IdentityQuery.of(b);
    int score = 0;
    if (!left.email().isEmpty() && left.email().equals(right.email())) {
      score += EMAIL_WEIGHT;
    }
    if (!left.phone().isEmpty() && left.phone().equals(right.phone())) {
      score += PHONE_WEIGHT;
    }
    if (!left.nameKey().isEmpty() && left.nameKey().equals(right.nameKey())) {
      score += NAME_WEIGHT;
    }
    return score;
  }

  /**
   * Lists pairs of active rows that share an identity characteristic and whose later
   * join falls on or before the earlier row's expiry.
   *
   * @param members the member sheet
   * @return candidate pairs, ordered by the rows' position in the sheet
   */
  public List<RenewalPair> findPossibleRenewals(List<Member> members) {
    Objects.requireNonNull(members, "members");
    List<RenewalPair> pairs = new ArrayList<>();
    for (int i = 0; i < members.size(); i++) {
      Member a = members.get(i);
      if (!a.isActive()) {
        continue;
      }
      for (int j = i + 1; j < members.size(); j++) {
        Member b = members.get(j);
        if (!b.isActive() || similarity(a, b) == 0) {
          continue;
        }
        RenewalPair pair = order(i, j, members);
        if (isEligible(members.get(pair.initial()), members.get(pair.latest()))) {
          pairs.add(pair);
        }
      }
    }
    return pairs;
  }

  /**
   * Merges two rows for one person into a single renewal.
   *
   * <p>The row that joined earlier ({@code INITIAL}) is removed. The later row keeps
   * its contact details and period, takes the earlier join and migration dates, is
   * renewed on its own join date and expires its period after the earlier expiry.
   * Both rows' schedule entries are replaced by entries for the merged row.
   *
   * <p>Nothing changes, and {@code success} is false, when the rows share no identity
   * characteristic or the later row joined after the earlier one expired. When the
   * emails differ, group subscriptions are moved to the surviving email first; a
   * failed move rejects the merge.
   *
   * @param rowA     index of one row
   * @param rowB     index of the other row
   * @param members  the member sheet
   * @param schedule the expiry schedule
   * @return the merge outcome with updated copies of both lists
   */
  public MergeResult convertJoinToRenew(int rowA, int rowB, List<Member> members, List<ScheduleEntry> schedule) {
    Objects.requireNonNull(members, "members");
    Objects.requireNonNull(schedule, "schedule");
    if (rowA == rowB || rowA < 0 || rowB < 0 || rowA >= members.size() || rowB >= members.size()) {
      return MergeResult.rejected("Invalid member rows: " + rowA + ", " + rowB, members, schedule);
    }
    RenewalPair pair = order(rowA, rowB, members);
    Member initial = members.get(pair.initial());
    Member latest = members.get(pair.latest());
    if (similarity(initial, latest) == 0) {
      return MergeResult.rejected("Members share no email, phone or name", members, schedule);
    }
    if (!isEligible(initial, latest)) {
      return MergeResult.rejected("Latest member joined on " + latest.joined()
          + " after the initial membership expired on " + initial.expires(), members, schedule);
    }

    if (!initial.email().equalsIgnoreCase(latest.email()) && groupMembership != null) {
      String failure = moveGroups(initial.email(), latest.email());
      if (failure != null) {
        return MergeResult.rejected(failure, members, schedule);
      }
    }

    Member merged = latest.toBuilder()
        .joined(initial.joined())
        .expires(initial.expires() == null ? null
            : MembershipDates.addYears(initial.expires(), latest.period()))
        .renewedOn(latest.joined())
        .migrated(initial.migrated())
        .status(MemberStatus.ACTIVE)
        .build();

    List<Member> updatedMembers = new ArrayList<>(members);
    updatedMembers.set(pair.latest(), merged);
    updatedMembers.remove(pair.initial());

    List<ScheduleEntry> updatedSchedule = scheduler.removeScheduleFor(initial.email(), schedule);
    updatedSchedule = scheduler.addRenewedMemberToSchedule(merged, updatedSchedule, LocalDate.now(clock));

    logger.log(Level.INFO, "Merged join of {0} into renewal of {1}, expires {2}",
        new Object[]{initial.email(), merged.email(), merged.expires()});
    return new MergeResult(true, "", updatedMembers, updatedSchedule);
  }

  private String moveGroups(String oldEmail, String newEmail) {
    GroupChangeResult result;
    try {
      result = groupMembership.replaceEmailInGroups(oldEmail, newEmail);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to move groups from " + oldEmail + " to " + newEmail, e);
      return "Failed to move groups from " + oldEmail + " to " + newEmail + ": " + e.getMessage();
    }
    if (result == null || !result.success()) {
      String detail = result == null ? "no result" : result.message();
      logger.log(Level.WARNING, "Group email replacement from {0} to {1} failed: {2}",
          new Object[]{oldEmail, newEmail, detail});
      return "Failed to move groups from " + oldEmail + " to " + newEmail + ": " + detail;
    }
    return null;
  }

  private static boolean isEligible(Member initial, Member latest) {
    if (latest.joined() == null || initial.expires() == null) {
      return false;
    }
    return !latest.joined().isAfter(initial.expires());
  }

  private static RenewalPair order(int a, int b, List<Member> members) {
    Comparator<LocalDate> byDate = Comparator.nullsLast(Comparator.naturalOrder());
    LocalDate joinedA = members.get(a).joined();
    LocalDate joinedB = members.get(b).joined();
    return byDate.compare(joinedA, joinedB) <= 0 ? new RenewalPair(a, b) : new RenewalPair(b, a);
  }

  /** Builder for {@link RenewalDetector}. */
  public static final class Builder {
    private ExpiryScheduler scheduler;
    private Clock clock;
    private GroupMembership groupMembership;

    private Builder() {}

    /**
     * Sets the scheduler used to rebuild the merged member's reminders.
     *
     * <p><b>Required.</b>
     *
     * @param scheduler the expiry scheduler
     * @return this builder
     */
    public Builder scheduler(ExpiryScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets the clock that supplies today's date.
     *
     * <p>Optional. Defaults to the system clock.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the group collaborator used to move subscriptions when a merge changes the
     * member's email.
     *
     * <p>Optional. Without it, subscriptions are left as they are.
     *
     * @param groupMembership the group collaborator
     * @return this builder
     */
    public Builder groupMembership(GroupMembership groupMembership) {
      this.groupMembership = groupMembership;
      return this;
    }

    public RenewalDetector build() {
      return new RenewalDetector(this);
    }
  }
}
