package membership;

import membership.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the {@link MembershipManager}'s periodic work on a single daemon thread:
 * transaction processing, expiry notification generation and one expiry queue drain
 * per cycle.
 *
 * <p>Each step is isolated: a failing step is logged and the remaining steps of the
 * cycle still run. Create instances via {@link #builder()}.
 */
public final class MembershipScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MembershipScheduler.class.getName());

  private final MembershipManager manager;
  private final long intervalSeconds;
  private final long initialDelaySeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private MembershipScheduler(Builder builder) {
    this.manager = Objects.requireNonNull(builder.manager, "manager");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    if (builder.initialDelaySeconds < 0L) {
      throw new IllegalArgumentException("initialDelaySeconds must be >= 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
    this.initialDelaySeconds = builder.initialDelaySeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("MembershipScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("membership-scheduler-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, initialDelaySeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one cycle on the calling thread. May be invoked directly for testing or
   * one-off runs.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    runStep("Transaction processing", manager::processTransactions);
    runStep("Expiry notification generation", manager::generateExpiryNotifications);
    runStep("Expiry queue processing", manager::processExpiryQueue);
  }

  private static void runStep(String name, Runnable step) {
    try {
      step.run();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, name + " failed", t);
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link MembershipScheduler}. */
  public static final class Builder {
    private MembershipManager manager;
    private long intervalSeconds = 900;
    private long initialDelaySeconds = 0;

    private Builder() {}

    /**
     * Sets the manager whose operations are scheduled.
     *
     * <p><b>Required.</b>
     *
     * @param manager the manager
     * @return this builder
     */
    public Builder manager(MembershipManager manager) {
      this.manager = manager;
      return this;
    }

    /**
     * Sets the delay in seconds between the end of one cycle and the start of the next.
     *
     * <p>Optional. Defaults to {@code 900} (15 minutes). Must be &gt; 0.
     *
     * @param intervalSeconds delay between cycles
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Sets the delay in seconds before the first cycle.
     *
     * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
     *
     * @param initialDelaySeconds delay before the first cycle
     * @return this builder
     */
    public Builder initialDelaySeconds(long initialDelaySeconds) {
      this.initialDelaySeconds = initialDelaySeconds;
      return this;
    }

    /**
     * @return a new scheduler; call {@link MembershipScheduler#start()} to begin
     */
    public MembershipScheduler build() {
      return new MembershipScheduler(this);
    }
  }
}
