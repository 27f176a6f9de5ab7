package membership.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import membership.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code membership.transactions.joined} - new members from payments</li>
 *   <li>{@code membership.transactions.renewed} - renewals from payments</li>
 *   <li>{@code membership.transactions.ambiguous} - payments left for review</li>
 *   <li>{@code membership.transactions.failed} - payments that failed and will be retried</li>
 *   <li>{@code membership.expiry.generated} - due schedule entries consumed</li>
 *   <li>{@code membership.queue.delivered} - expiry items completed</li>
 *   <li>{@code membership.queue.retried} - expiry items rescheduled</li>
 *   <li>{@code membership.queue.dead} - expiry items moved to dead letters</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code membership.queue.depth} - expiry queue length after the last run</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "membership";

  private final MeterRegistry registry;
  private final Counter joined;
  private final Counter renewed;
  private final Counter ambiguous;
  private final Counter failed;
  private final Counter expiryGenerated;
  private final Counter queueDelivered;
  private final Counter queueRetried;
  private final Counter queueDead;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "membership"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several clubs in
   * one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chess.membership"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.joined = counter(namePrefix + ".transactions.joined", "Members who joined from a payment");
    this.renewed = counter(namePrefix + ".transactions.renewed", "Members who renewed from a payment");
    this.ambiguous = counter(namePrefix + ".transactions.ambiguous", "Payments left for manual review");
    this.failed = counter(namePrefix + ".transactions.failed", "Payments that failed and stay unprocessed");
    this.expiryGenerated = counter(namePrefix + ".expiry.generated", "Due expiry schedule entries consumed");
    this.queueDelivered = counter(namePrefix + ".queue.delivered", "Expiry items completed");
    this.queueRetried = counter(namePrefix + ".queue.retried", "Expiry items rescheduled after a failure");
    this.queueDead = counter(namePrefix + ".queue.dead", "Expiry items moved to dead letters");
    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Expiry queue length after the last run")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementTransactionsJoined() {
    if (closed) return;
    joined.increment();
  }

  @Override
  public void incrementTransactionsRenewed() {
    if (closed) return;
    renewed.increment();
  }

  @Override
  public void incrementTransactionsAmbiguous() {
    if (closed) return;
    ambiguous.increment();
  }

  @Override
  public void incrementTransactionsFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementExpiryGenerated(int count) {
    if (closed || count <= 0) return;
    expiryGenerated.increment(count);
  }

  @Override
  public void incrementQueueDelivered() {
    if (closed) return;
    queueDelivered.increment();
  }

  @Override
  public void incrementQueueRetried() {
    if (closed) return;
    queueRetried.increment();
  }

  @Override
  public void incrementQueueDead() {
    if (closed) return;
    queueDead.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(joined, renewed, ambiguous, failed, expiryGenerated,
        queueDelivered, queueRetried, queueDead, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
