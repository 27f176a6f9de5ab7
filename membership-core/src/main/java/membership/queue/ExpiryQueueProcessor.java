package membership.queue;

import membership.audit.AuditLogEntry;
import membership.audit.AuditLogger;
import membership.model.FifoItem;
import membership.model.Notification;
import membership.spi.GroupMembership;
import membership.spi.MetricsExporter;
import membership.spi.NotificationSender;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the expiry FIFO queue: sends each item's message, removes the member from
 * the item's groups and keeps retry bookkeeping for failures.
 *
 * <p>Per item the states are pending, processed, retry-pending and dead. Groups are
 * removed last to first and dropped from the item as each removal succeeds, so a retry
 * never repeats completed work. Any exception fails the whole item once. An item whose
 * attempts reach its limit ({@link FifoItem#maxAttempts()}, else the processor's) goes
 * dead and yields a {@code DeadLetter} audit entry; otherwise it is rescheduled with
 * the {@link RetryPolicy}, or in one minute if the policy itself fails.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ExpiryQueueProcessor {
  private static final Logger logger = Logger.getLogger(ExpiryQueueProcessor.class.getName());

  static final String DEAD_LETTER = "DeadLetter";
  static final Duration FALLBACK_RETRY_DELAY = Duration.ofMinutes(1);

  private final NotificationSender notificationSender;
  private final GroupMembership groupMembership;
  private final RetryPolicy retryPolicy;
  private final int batchSize;
  private final int maxAttempts;
  private final Duration triggerInterval;
  private final Clock clock;
  private final AuditLogger auditLogger;
  private final MetricsExporter metrics;

  private ExpiryQueueProcessor(Builder builder) {
    this.notificationSender = Objects.requireNonNull(builder.notificationSender, "notificationSender");
    this.groupMembership = Objects.requireNonNull(builder.groupMembership, "groupMembership");
    ExpiryQueue.requirePositive(builder.batchSize, "batchSize");
    ExpiryQueue.requirePositive(builder.maxAttempts, "maxAttempts");
    if (builder.triggerInterval != null && (builder.triggerInterval.isZero() || builder.triggerInterval.isNegative())) {
      throw new IllegalArgumentException("triggerInterval must be positive");
    }
    this.batchSize = builder.batchSize;
    this.maxAttempts = builder.maxAttempts;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.triggerInterval = builder.triggerInterval != null ? builder.triggerInterval : Duration.ofMinutes(1);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.auditLogger = new AuditLogger(clock);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one drain over the queue: selects a batch, processes it, rebuilds the queue
   * and stamps the next batch with the next trigger time.
   *
   * @param queue the persisted queue; not modified
   * @return the next queue and the run's outcome
   * @throws NullPointerException if {@code queue} is null
   */
  public QueueRunResult process(List<FifoItem> queue) {
    Objects.requireNonNull(queue, "queue");
    Instant now = clock.instant();
    FifoBatch batch = ExpiryQueue.selectBatch(queue, batchSize, now);

    List<FifoItem> retries = new ArrayList<>();
    List<FifoItem> dead = new ArrayList<>();
    List<AuditLogEntry> auditEntries = new ArrayList<>();
    int delivered = 0;
    for (FifoItem item : batch.items()) {
      FifoItem outcome = processItem(item, now);
      if (outcome == null) {
        delivered++;
        metrics.incrementQueueDelivered();
      } else if (outcome.dead()) {
        dead.add(outcome);
        auditEntries.add(deadLetterEntry(outcome));
        metrics.incrementQueueDead();
      } else {
        retries.add(outcome);
        metrics.incrementQueueRetried();
      }
    }

    List<FifoItem> rebuilt = ExpiryQueue.rebuildQueue(queue, batch.indices(), retries);
    List<FifoItem> next = ExpiryQueue.assignNextBatchTimestamps(rebuilt, batchSize, now,
        now.plus(triggerInterval));
    metrics.recordQueueDepth((int) next.stream().filter(Objects::nonNull).count());
    if (!batch.isEmpty()) {
      logger.log(Level.INFO, "Expiry queue run: {0} delivered, {1} retrying, {2} dead, {3} remaining",
          new Object[]{delivered, retries.size(), dead.size(), next.size()});
    }
    return new QueueRunResult(next, delivered, retries.size(), dead, auditEntries);
  }

  /**
   * Processes one item.
   *
   * @return {@code null} when every side effect completed, else the failed item with
   *     updated bookkeeping
   */
  FifoItem processItem(FifoItem item, Instant now) {
    FifoItem current = item;
    try {
      if (current.hasMessage()) {
        notificationSender.send(new Notification(current.email(), current.subject(), current.htmlBody()));
        current = current.withoutMessage();
      }
      List<String> remaining = new ArrayList<>(current.groups());
      for (int g = remaining.size() - 1; g >= 0; g--) {
        groupMembership.removeFromGroup(current.email(), remaining.get(g));
        remaining.remove(g);
        current = current.withGroups(remaining);
      }
      return null;
    } catch (Exception e) {
      return recordFailure(current, e, now);
    }
  }

  private FifoItem recordFailure(FifoItem item, Exception failure, Instant now) {
    int attempts = item.attempts() + 1;
    int limit = item.maxAttempts() != null ? item.maxAttempts() : maxAttempts;
    String error = failure.getMessage() != null ? failure.getMessage() : failure.toString();
    if (attempts >= limit) {
      logger.log(Level.SEVERE, "Expiry item " + item.id() + " for " + item.email()
          + " moved to dead letters after " + attempts + " attempts", failure);
      return item.withFailure(now, error, null, true);
    }
    Instant nextAt = nextAttemptAt(now, attempts);
    logger.log(Level.WARNING, "Expiry item {0} for {1} failed (attempt {2}), retrying at {3}: {4}",
        new Object[]{item.id(), item.email(), attempts, nextAt, error});
    return item.withFailure(now, error, nextAt, false);
  }

  private Instant nextAttemptAt(Instant now, int attempts) {
    try {
      return retryPolicy.nextAttemptAt(now, attempts);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Retry policy failed; retrying in " + FALLBACK_RETRY_DELAY, e);
      return now.plus(FALLBACK_RETRY_DELAY);
    }
  }

  private AuditLogEntry deadLetterEntry(FifoItem item) {
    Map<String, String> data = new LinkedHashMap<>();
    data.put("id", item.id());
    data.put("email", item.email());
    data.put("attempts", Integer.toString(item.attempts()));
    data.put("groups", item.groupsAsString());
    return auditLogger.failure(DEAD_LETTER,
        "Expiry item for " + item.email() + " abandoned after " + item.attempts() + " attempts",
        item.lastError(), data);
  }

  /** Builder for {@link ExpiryQueueProcessor}. */
  public static final class Builder {
    private NotificationSender notificationSender;
    private GroupMembership groupMembership;
    private RetryPolicy retryPolicy;
    private int batchSize = 50;
    private int maxAttempts = 5;
    private Duration triggerInterval;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the collaborator that sends expiry messages.
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
     * Sets the collaborator that removes expired members from groups.
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
     * Sets the backoff for failed items.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a one-minute base.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of items processed per run.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &ge; 1.
     *
     * @param batchSize max items per run
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the attempt limit for items without their own {@code maxAttempts}.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts attempts before an item goes dead
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the time until the next run, used to stamp the next batch.
     *
     * <p>Optional. Defaults to {@code 1 minute}.
     *
     * @param triggerInterval interval between runs
     * @return this builder
     */
    public Builder triggerInterval(Duration triggerInterval) {
      this.triggerInterval = triggerInterval;
      return this;
    }

    /**
     * Sets the clock for attempt timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
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
     * @return a new processor
     * @throws NullPointerException if {@code notificationSender} or {@code groupMembership} is null
     * @throws IllegalArgumentException if {@code batchSize} or {@code maxAttempts} is below 1
     */
    public ExpiryQueueProcessor build() {
      return new ExpiryQueueProcessor(this);
    }
  }
}
