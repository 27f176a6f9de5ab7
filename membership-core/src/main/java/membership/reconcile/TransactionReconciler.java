package membership.reconcile;

import membership.identity.AmbiguityResolver;
import membership.identity.IdentityIndex;
import membership.identity.IdentityQuery;
import membership.identity.MatchResult;
import membership.model.ActionSpec;
import membership.model.ActionSpecs;
import membership.model.ActionType;
import membership.model.AmbiguousTransaction;
import membership.model.DirectorySharing;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.Notification;
import membership.model.RowError;
import membership.model.ScheduleEntry;
import membership.model.Transaction;
import membership.schedule.ExpiryScheduler;
import membership.schedule.MembershipDates;
import membership.spi.GroupMembership;
import membership.spi.NotificationSender;
import membership.util.TemplateExpander;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies paid transactions to the member sheet.
 *
 * <p>Each unprocessed, paid transaction is resolved against the active members and
 * becomes a join (new member), a renewal (existing member) or an ambiguous record
 * left for manual review. A join or renewal is committed only once its group
 * subscriptions and its notification succeed; otherwise the transaction is reported
 * in {@link ReconciliationResult#errors()} and stays unprocessed for the next run.
 * A join needs an email address; a paid transaction without one that matches no
 * member is reported the same way. One failing transaction never stops the rest of
 * the batch.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class TransactionReconciler {
  private static final Logger logger = Logger.getLogger(TransactionReconciler.class.getName());

  private final ActionSpecs actionSpecs;
  private final ExpiryScheduler scheduler;
  private final AmbiguityResolver resolver;
  private final NotificationSender notificationSender;
  private final GroupMembership groupMembership;
  private final List<String> groups;
  private final Clock clock;

  private TransactionReconciler(Builder builder) {
    this.actionSpecs = Objects.requireNonNull(builder.actionSpecs, "actionSpecs");
    this.notificationSender = Objects.requireNonNull(builder.notificationSender, "notificationSender");
    this.groups = builder.groups != null ? List.copyOf(builder.groups) : List.of();
    if (!groups.isEmpty()) {
      Objects.requireNonNull(builder.groupMembership, "groupMembership");
    }
    this.groupMembership = builder.groupMembership;
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.scheduler = new ExpiryScheduler(actionSpecs);
    this.resolver = new AmbiguityResolver();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reconciles a batch of transactions. Inputs are not modified.
   *
   * @param transactions the transactions sheet
   * @param members      the member sheet
   * @param schedule     the expiry schedule
   * @return updated copies of all three plus run statistics
   */
  public ReconciliationResult reconcile(List<Transaction> transactions, List<Member> members,
      List<ScheduleEntry> schedule) {
    Objects.requireNonNull(transactions, "transactions");
    Objects.requireNonNull(members, "members");
    Objects.requireNonNull(schedule, "schedule");
    LocalDate today = LocalDate.now(clock);

    Run run = new Run(transactions, members, schedule);
    for (int i = 0; i < run.transactions.size(); i++) {
      Transaction txn = run.transactions.get(i);
      int rowNumber = i + 2;
      if (txn.isProcessed()) {
        continue;
      }
      if (!txn.isPaid()) {
        run.hasPendingPayments = true;
        continue;
      }
      MatchResult match = resolver.resolve(IdentityQuery.of(txn), run.index);
      try {
        if (match instanceof MatchResult.Unique unique) {
          logger.log(Level.INFO, "Transaction on row {0} ({1}) is a renewing member",
              new Object[]{rowNumber, txn.emailAddress()});
          renew(run, i, unique.index(), today);
        } else if (match instanceof MatchResult.Ambiguous ambiguous) {
          logger.log(Level.WARNING, "Transaction on row {0} ({1}) matches members {2}; left for review",
              new Object[]{rowNumber, txn.emailAddress(), ambiguous.candidates()});
          run.ambiguous.add(new AmbiguousTransaction(rowNumber, txn, ambiguous.candidates()));
          run.hasPendingPayments = true;
        } else {
          logger.log(Level.INFO, "Transaction on row {0} ({1}) is a new member",
              new Object[]{rowNumber, txn.emailAddress()});
          join(run, i, today);
        }
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to process transaction on row " + rowNumber, e);
        run.errors.add(new RowError(rowNumber, txn.emailAddress(), describe(e)));
      }
    }
    return new ReconciliationResult(run.transactions, run.members, run.schedule, run.recordsChanged,
        run.hasPendingPayments, run.errors, run.ambiguous, run.notifications, run.joined, run.renewed);
  }

  private void join(Run run, int txnIndex, LocalDate today) throws Exception {
    Transaction txn = run.transactions.get(txnIndex);
    if (txn.emailAddress().isEmpty()) {
      throw new IllegalArgumentException("Email Address is required for a new member");
    }
    int period = PaymentTerms.periodOf(txn.payment());
    Member member = Member.builder()
        .email(txn.emailAddress())
        .first(txn.firstName())
        .last(txn.lastName())
        .phone(txn.phone())
        .joined(today)
        .expires(MembershipDates.addYears(today, period))
        .period(period)
        .status(MemberStatus.ACTIVE)
        .directory(DirectorySharing.parse(txn.directory()))
        .build();
    List<ScheduleEntry> entries = scheduler.scheduleEntriesFor(member.email(), member.expires(), today);
    for (String group : groups) {
      groupMembership.addToGroup(member.email(), group);
    }
    Notification notification = render(ActionType.JOIN, member);
    notificationSender.send(notification);

    run.members.add(member);
    run.index.register(run.members.size() - 1, member);
    run.schedule.addAll(entries);
    run.transactions.set(txnIndex, txn.markProcessed(today));
    run.notifications.add(notification);
    run.recordsChanged = true;
    run.joined++;
  }

  private void renew(Run run, int txnIndex, int memberIndex, LocalDate today) throws Exception {
    Transaction txn = run.transactions.get(txnIndex);
    Member current = run.members.get(memberIndex);
    int period = PaymentTerms.periodOf(txn.payment());
    Member renewed = current.toBuilder()
        .period(period)
        .renewedOn(today)
        .expires(MembershipDates.calculateExpirationDate(today, current.expires(), period))
        .directory(DirectorySharing.parse(txn.directory()))
        .build();
    List<ScheduleEntry> schedule = scheduler.addRenewedMemberToSchedule(renewed, run.schedule, today);
    Notification notification = render(ActionType.RENEW, renewed);
    notificationSender.send(notification);

    run.members.set(memberIndex, renewed);
    run.schedule = schedule;
    run.transactions.set(txnIndex, txn.markProcessed(today));
    run.notifications.add(notification);
    run.recordsChanged = true;
    run.renewed++;
  }

  private Notification render(ActionType type, Member member) {
    ActionSpec spec = actionSpecs.require(type);
    return new Notification(member.email(),
        TemplateExpander.expand(spec.subject(), member.toFields()),
        TemplateExpander.expand(spec.body(), member.toFields()));
  }

  static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  /** Mutable working state of one reconciliation run. */
  private static final class Run {
    final List<Transaction> transactions;
    final List<Member> members;
    List<ScheduleEntry> schedule;
    final IdentityIndex index;
    final List<RowError> errors = new ArrayList<>();
    final List<AmbiguousTransaction> ambiguous = new ArrayList<>();
    final List<Notification> notifications = new ArrayList<>();
    boolean recordsChanged;
    boolean hasPendingPayments;
    int joined;
    int renewed;

    Run(List<Transaction> transactions, List<Member> members, List<ScheduleEntry> schedule) {
      this.transactions = new ArrayList<>(transactions);
      this.members = new ArrayList<>(members);
      this.schedule = new ArrayList<>(schedule);
      this.index = IdentityIndex.of(this.members);
    }
  }

  /** Builder for {@link TransactionReconciler}. */
  public static final class Builder {
    private ActionSpecs actionSpecs;
    private NotificationSender notificationSender;
    private GroupMembership groupMembership;
    private List<String> groups;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the message templates and expiry offsets. Must include {@code Join} and
     * {@code Renew} specs.
     *
     * <p><b>Required.</b>
     *
     * @param actionSpecs the action specs
     * @return this builder
     */
    public Builder actionSpecs(ActionSpecs actionSpecs) {
      this.actionSpecs = actionSpecs;
      return this;
    }

    /**
     * Sets the collaborator that sends join and renewal messages.
     *
     * <p><b>Required.</b>
     *
     * @param notificationSender the sender
     * @return this builder
     */
    public Builder notificationSender(NotificationSender notificationSender) {
      this.notificationSender = notificationSender;
      return this;
    }

    /**
     * Sets the group collaborator used to subscribe new members.
     *
     * <p>Required when {@link #groups(List)} is non-empty.
     *
     * @param groupMembership the group collaborator
     * @return this builder
     */
    public Builder groupMembership(GroupMembership groupMembership) {
      this.groupMembership = groupMembership;
      return this;
    }

    /**
     * Sets the group addresses every new member is subscribed to.
     *
     * <p>Optional. Defaults to none.
     *
     * @param groups group addresses
     * @return this builder
     */
    public Builder groups(List<String> groups) {
      this.groups = groups;
      return this;
    }

    /**
     * Sets the clock that supplies the run date.
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
     * @return a new reconciler
     * @throws NullPointerException if a required collaborator is missing
     */
    public TransactionReconciler build() {
      return new TransactionReconciler(this);
    }
  }
}
