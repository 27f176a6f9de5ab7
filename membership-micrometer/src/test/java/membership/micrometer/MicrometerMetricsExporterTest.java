package membership.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void transactionCounters() {
    exporter.incrementTransactionsJoined();
    exporter.incrementTransactionsJoined();
    exporter.incrementTransactionsRenewed();
    exporter.incrementTransactionsAmbiguous();
    exporter.incrementTransactionsFailed();

    assertEquals(2.0, counter("membership.transactions.joined").count());
    assertEquals(1.0, counter("membership.transactions.renewed").count());
    assertEquals(1.0, counter("membership.transactions.ambiguous").count());
    assertEquals(1.0, counter("membership.transactions.failed").count());
  }

  @Test
  void expiryGeneratedAddsCount() {
    exporter.incrementExpiryGenerated(3);
    exporter.incrementExpiryGenerated(0);

    assertEquals(3.0, counter("membership.expiry.generated").count());
  }

  @Test
  void queueCountersAndDepth() {
    exporter.incrementQueueDelivered();
    exporter.incrementQueueRetried();
    exporter.incrementQueueDead();
    exporter.recordQueueDepth(42);

    assertEquals(1.0, counter("membership.queue.delivered").count());
    assertEquals(1.0, counter("membership.queue.retried").count());
    assertEquals(1.0, counter("membership.queue.dead").count());
    assertEquals(42.0, gauge("membership.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("membership.queue.depth").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "chess.membership");
    custom.incrementQueueDelivered();
    custom.recordQueueDepth(5);

    assertEquals(1.0, counter("chess.membership.queue.delivered").count());
    assertEquals(5.0, gauge("chess.membership.queue.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertNull(registry.find("membership.transactions.joined").counter());
    assertNull(registry.find("membership.queue.depth").gauge());
    assertDoesNotThrow(() -> exporter.incrementTransactionsJoined());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "club."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
