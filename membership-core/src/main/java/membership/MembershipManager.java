package membership;

import membership.audit.AuditLogEntry;
import membership.audit.AuditLogger;
import membership.model.ActionSpecs;
import membership.model.AmbiguousTransaction;
import membership.model.Member;
import membership.model.RowError;
import membership.model.ScheduleEntry;
import membership.migrate.MemberMigrator;
import membership.migrate.MigrationResult;
import membership.queue.EnqueueResult;
import membership.queue.ExpiryQueue;
import membership.queue.ExpiryQueueProcessor;
import membership.queue.ExponentialBackoffRetryPolicy;
import membership.queue.QueueRunResult;
import membership.queue.RetryPolicy;
import membership.reconcile.ReconciliationResult;
import membership.reconcile.TransactionReconciler;
import membership.renewal.MergeResult;
import membership.renewal.RenewalDetector;
import membership.renewal.RenewalPair;
import membership.schedule.ExpiryScheduler;
import membership.schedule.GenerationResult;
import membership.schedule.NotificationGenerator;
import membership.spi.AmbiguousTransactionStore;
import membership.spi.AuditSink;
import membership.spi.ExpiryQueueStore;
import membership.spi.GroupMembership;
import membership.spi.MembershipStore;
import membership.spi.MetricsExporter;
import membership.spi.NotificationSender;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry points of the membership engine, wired to storage and external services.
 *
 * <p>Each operation loads what it needs from the {@link MembershipStore} and
 * {@link ExpiryQueueStore}, runs the pure engine component and writes the results
 * back. Action specs are reloaded on every call so template edits take effect
 * immediately. Operations are serialized on this instance.
 *
 * <pre>{@code
 * MembershipManager manager = MembershipManager.builder()
 *     .membershipStore(store)
 *     .queueStore(queueStore)
 *     .notificationSender(mailer)
 *     .groupMembership(groups)
 *     .groups(List.of("members@club.org"))
 *     .build();
 *
 * manager.processTransactions();
 * manager.generateExpiryNotifications();
 * manager.processExpiryQueue();
 * }</pre>
 *
 * @see MembershipScheduler
 */
public final class MembershipManager {
  private static final Logger logger = Logger.getLogger(MembershipManager.class.getName());

  static final String TRANSACTION = "Transaction";
  static final String MIGRATION = "Migration";
  static final String MERGE = "Merge";
  static final String EXPIRY = "Expiry";

  private final MembershipStore membershipStore;
  private final ExpiryQueueStore queueStore;
  private final NotificationSender notificationSender;
  private final GroupMembership groupMembership;
  private final List<String> groups;
  private final Clock clock;
  private final AuditSink auditSink;
  private final AuditLogger auditLogger;
  private final AmbiguousTransactionStore ambiguousStore;
  private final MetricsExporter metrics;
  private final ExpiryQueueProcessor queueProcessor;

  private MembershipManager(Builder builder) {
    this.membershipStore = Objects.requireNonNull(builder.membershipStore, "membershipStore");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.notificationSender = Objects.requireNonNull(builder.notificationSender, "notificationSender");
    this.groupMembership = Objects.requireNonNull(builder.groupMembership, "groupMembership");
    this.groups = builder.groups != null ? List.copyOf(builder.groups) : List.of();
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.auditSink = builder.auditSink != null ? builder.auditSink : AuditSink.NOOP;
    this.auditLogger = new AuditLogger(clock);
    this.ambiguousStore = builder.ambiguousStore;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.queueProcessor = ExpiryQueueProcessor.builder()
        .notificationSender(notificationSender)
        .groupMembership(groupMembership)
        .retryPolicy(builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy())
        .batchSize(builder.batchSize)
        .maxAttempts(builder.maxAttempts)
        .triggerInterval(builder.triggerInterval)
        .clock(clock)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Applies all unprocessed paid transactions. Member, schedule and transaction sheets
   * are saved when anything changed; ambiguous transactions go to the review store.
   *
   * @return the reconciliation outcome
   */
  public synchronized ReconciliationResult processTransactions() {
    TransactionReconciler reconciler = TransactionReconciler.builder()
        .actionSpecs(loadActionSpecs())
        .notificationSender(notificationSender)
        .groupMembership(groupMembership)
        .groups(groups)
        .clock(clock)
        .build();
    ReconciliationResult result = reconciler.reconcile(membershipStore.loadTransactions(),
        membershipStore.loadMembers(), membershipStore.loadSchedule());

    if (result.recordsChanged()) {
      membershipStore.saveMembers(result.members());
      membershipStore.saveSchedule(result.schedule());
      membershipStore.saveTransactions(result.transactions());
    }
    persistAmbiguousTransactions(result.ambiguousTransactions());

    List<AuditLogEntry> entries = new ArrayList<>();
    if (result.recordsChanged()) {
      entries.add(auditLogger.success(TRANSACTION,
          "Processed " + result.joined() + " joins and " + result.renewed() + " renewals",
          counts(result.joined(), result.renewed())));
    }
    entries.addAll(errorEntries(TRANSACTION, result.errors()));
    auditSink.persist(entries);

    for (int i = 0; i < result.joined(); i++) {
      metrics.incrementTransactionsJoined();
    }
    for (int i = 0; i < result.renewed(); i++) {
      metrics.incrementTransactionsRenewed();
    }
    for (int i = 0; i < result.ambiguousTransactions().size(); i++) {
      metrics.incrementTransactionsAmbiguous();
    }
    for (int i = 0; i < result.errors().size(); i++) {
      metrics.incrementTransactionsFailed();
    }
    return result;
  }

  /**
   * Replaces the review store's rows with the given ambiguous transactions, if a
   * store is configured. An empty list clears rows that no longer need review.
   *
   * @param ambiguous the transactions currently awaiting review
   * @return number of rows written; 0 when there was nothing to write or no store
   */
  public int persistAmbiguousTransactions(List<AmbiguousTransaction> ambiguous) {
    Objects.requireNonNull(ambiguous, "ambiguous");
    if (ambiguousStore == null) {
      if (!ambiguous.isEmpty()) {
        logger.log(Level.WARNING, "{0} ambiguous transactions found but no review store is configured",
            ambiguous.size());
      }
      return 0;
    }
    List<Map<String, String>> rows = new ArrayList<>(ambiguous.size());
    for (AmbiguousTransaction transaction : ambiguous) {
      rows.add(transaction.toRow());
    }
    ambiguousStore.write(rows);
    return rows.size();
  }

  /**
   * Imports pending rows from the legacy member list.
   *
   * @return the migration outcome
   */
  public synchronized MigrationResult processMigrations() {
    MemberMigrator migrator = new MemberMigrator(loadActionSpecs(), notificationSender, groupMembership, clock);
    MigrationResult result = migrator.migrate(membershipStore.loadMigrators(),
        membershipStore.loadMembers(), membershipStore.loadSchedule());
    if (result.migrated() > 0) {
      membershipStore.saveMembers(result.members());
      membershipStore.saveSchedule(result.schedule());
      membershipStore.saveMigrators(result.migrators());
      auditSink.persist(List.of(auditLogger.success(MIGRATION,
          "Migrated " + result.migrated() + " members", null)));
    }
    auditSink.persist(errorEntries(MIGRATION, result.errors()));
    return result;
  }

  /**
   * Consumes due schedule entries, expires members at the terminal reminder and
   * appends the resulting payloads to the expiry queue.
   *
   * @return the generator outcome
   */
  public synchronized GenerationResult generateExpiryNotifications() {
    NotificationGenerator generator = new NotificationGenerator(loadActionSpecs(), groups, clock);
    GenerationResult result = generator.generate(membershipStore.loadMembers(), membershipStore.loadSchedule());
    if (result.processedCount() == 0) {
      return result;
    }
    if (!result.notifications().isEmpty()) {
      EnqueueResult enqueued = ExpiryQueue.enqueue(queueStore.loadQueue(), result.notifications());
      queueStore.saveQueue(enqueued.queue());
      auditSink.persist(rejectionEntries(enqueued.rejected()));
    }
    membershipStore.saveMembers(result.members());
    membershipStore.saveSchedule(result.schedule());
    metrics.incrementExpiryGenerated(result.processedCount());
    logger.log(Level.INFO, "Queued {0} expiry notifications from {1} due schedule entries",
        new Object[]{result.notifications().size(), result.processedCount()});
    return result;
  }

  /**
   * Drains one batch of the expiry queue. Dead items are moved to the dead-letter
   * list and audited.
   *
   * @return the drain outcome
   */
  public synchronized QueueRunResult processExpiryQueue() {
    QueueRunResult result = queueProcessor.process(queueStore.loadQueue());
    queueStore.saveQueue(result.queue());
    if (!result.dead().isEmpty()) {
      queueStore.appendDeadLetters(result.dead());
    }
    auditSink.persist(result.auditEntries());
    return result;
  }

  /**
   * Lists member pairs that look like a renewal recorded as a second join.
   */
  public synchronized List<RenewalPair> findPossibleRenewals() {
    return renewalDetector(loadActionSpecs()).findPossibleRenewals(membershipStore.loadMembers());
  }

  /**
   * Merges two member rows into one renewal and saves the result.
   *
   * @param rowA index of one member row
   * @param rowB index of the other member row
   * @return the merge outcome; on failure nothing is saved
   */
  public synchronized MergeResult convertJoinToRenew(int rowA, int rowB) {
    List<Member> members = membershipStore.loadMembers();
    List<ScheduleEntry> schedule = membershipStore.loadSchedule();
    MergeResult result = renewalDetector(loadActionSpecs()).convertJoinToRenew(rowA, rowB, members, schedule);
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("rowA", Integer.toString(rowA));
    rows.put("rowB", Integer.toString(rowB));
    if (result.success()) {
      membershipStore.saveMembers(result.members());
      membershipStore.saveSchedule(result.schedule());
      auditSink.persist(List.of(auditLogger.success(MERGE, "Converted join to renewal", rows)));
    } else {
      auditSink.persist(List.of(auditLogger.failure(MERGE, "Join to renewal rejected", result.message(), rows)));
    }
    return result;
  }

  private RenewalDetector renewalDetector(ActionSpecs specs) {
    return RenewalDetector.builder()
        .scheduler(new ExpiryScheduler(specs))
        .clock(clock)
        .groupMembership(groupMembership)
        .build();
  }

  private ActionSpecs loadActionSpecs() {
    return ActionSpecs.of(membershipStore.loadActionSpecs());
  }

  private List<AuditLogEntry> errorEntries(String type, List<RowError> errors) {
    List<AuditLogEntry> entries = new ArrayList<>(errors.size());
    for (RowError error : errors) {
      Map<String, String> data = new LinkedHashMap<>();
      data.put("row", Integer.toString(error.rowNumber()));
      data.put("email", error.email());
      entries.add(auditLogger.failure(type, "Row " + error.rowNumber() + " failed", error.message(), data));
    }
    return entries;
  }

  private List<AuditLogEntry> rejectionEntries(List<EnqueueResult.Rejected> rejected) {
    List<AuditLogEntry> entries = new ArrayList<>(rejected.size());
    for (EnqueueResult.Rejected r : rejected) {
      String email = r.notification().email();
      logger.log(Level.WARNING, "Expiry notification for \"{0}\" not queued: {1}", new Object[]{email, r.reason()});
      Map<String, String> data = new LinkedHashMap<>();
      data.put("email", email);
      data.put("subject", r.notification().subject());
      entries.add(auditLogger.failure(EXPIRY, "Expiry notification not queued", r.reason(), data));
    }
    return entries;
  }

  private static Map<String, String> counts(int joined, int renewed) {
    Map<String, String> data = new LinkedHashMap<>();
    data.put("joined", Integer.toString(joined));
    data.put("renewed", Integer.toString(renewed));
    return data;
  }

  /** Builder for {@link MembershipManager}. */
  public static final class Builder {
    private MembershipStore membershipStore;
    private ExpiryQueueStore queueStore;
    private NotificationSender notificationSender;
    private GroupMembership groupMembership;
    private List<String> groups;
    private Clock clock;
    private AuditSink auditSink;
    private AmbiguousTransactionStore ambiguousStore;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private int batchSize = 50;
    private int maxAttempts = 5;
    private Duration triggerInterval;

    private Builder() {}

    /**
     * Sets the store for members, transactions, schedule, migration rows and action specs.
     *
     * <p><b>Required.</b>
     *
     * @param membershipStore the store
     * @return this builder
     */
    public Builder membershipStore(MembershipStore membershipStore) {
      this.membershipStore = membershipStore;
      return this;
    }

    /**
     * Sets the store for the expiry queue and dead letters.
     *
     * <p><b>Required.</b>
     *
     * @param queueStore the store
     * @return this builder
     */
    public Builder queueStore(ExpiryQueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * Sets the email sender.
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
     * Sets the group collaborator.
     *
     * <p><b>Required.</b>
     *
     * @param groupMembership the group collaborator
     * @return this builder
     */
    public Builder groupMembership(GroupMembership groupMembership) {
      this.groupMembership = groupMembership;
      return this;
    }

    /**
     * Sets the member groups: new members join them and expired members leave them.
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
     * Sets the clock for run dates and timestamps.
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
     * Sets the audit destination.
     *
     * <p>Optional. Defaults to {@link AuditSink#NOOP}.
     *
     * @param auditSink the sink
     * @return this builder
     */
    public Builder auditSink(AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    /**
     * Sets the review store for ambiguous transactions.
     *
     * <p>Optional. Without it ambiguous transactions are only logged.
     *
     * @param ambiguousStore the store
     * @return this builder
     */
    public Builder ambiguousStore(AmbiguousTransactionStore ambiguousStore) {
      this.ambiguousStore = ambiguousStore;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the backoff for failed expiry items.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy}.
     *
     * @param retryPolicy the policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the expiry queue batch size.
     *
     * <p>Optional. Defaults to {@code 50}.
     *
     * @param batchSize max items per queue run
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the default attempt limit for expiry items.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param maxAttempts attempts before an item goes dead
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the time between queue runs, used to stamp the next batch.
     *
     * <p>Optional. Defaults to {@code 1 minute}.
     *
     * @param triggerInterval interval between queue runs
     * @return this builder
     */
    public Builder triggerInterval(Duration triggerInterval) {
      this.triggerInterval = triggerInterval;
      return this;
    }

    /**
     * @return a new manager
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if {@code batchSize} or {@code maxAttempts} is below 1
     */
    public MembershipManager build() {
      return new MembershipManager(this);
    }
  }
}
