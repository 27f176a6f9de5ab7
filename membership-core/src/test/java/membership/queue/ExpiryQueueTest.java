package membership.queue;

import membership.model.ExpiryNotification;
import membership.model.FifoItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryQueueTest {

  private static final Instant NOW = Instant.parse("2025-11-25T12:00:00Z");

  static FifoItem item(String id, String nextAttemptAt) {
    return new FifoItem(id, id + "@x.com", "Subject", "<p>Body</p>", List.of(), 0, "", "",
        nextAttemptAt, null, false);
  }

  @Test
  void enqueueAppendsNewItems() {
    List<FifoItem> queue = List.of(item("a", ""));

    List<FifoItem> updated = ExpiryQueue.enqueue(queue, List.of(
        new ExpiryNotification("b@x.com", "Expired", "<p>Bye</p>", List.of("g@x.com")))).queue();

    assertEquals(1, queue.size());
    assertEquals(2, updated.size());
    FifoItem added = updated.get(1);
    assertEquals("b@x.com", added.email());
    assertEquals(0, added.attempts());
    assertEquals(List.of("g@x.com"), added.groups());
    assertFalse(added.id().isEmpty());
    assertNotEquals(updated.get(0).id(), added.id());
  }

  @Test
  void enqueueRejectsInvalidAddressesAndKeepsTheRest() {
    EnqueueResult result = ExpiryQueue.enqueue(List.of(), List.of(
        new ExpiryNotification("bob@localhost", "Expiring", "<p>Soon</p>", List.of()),
        new ExpiryNotification("", "Expiring", "<p>Soon</p>", List.of()),
        new ExpiryNotification("good@x.com", "Expiring", "<p>Soon</p>", List.of())));

    assertEquals(1, result.queue().size());
    assertEquals("good@x.com", result.queue().get(0).email());
    assertEquals(2, result.rejected().size());
    assertEquals("bob@localhost", result.rejected().get(0).notification().email());
    assertEquals("Invalid email address: bob@localhost", result.rejected().get(0).reason());
    assertEquals("", result.rejected().get(1).notification().email());
  }

  @Test
  void selectBatchTakesEligibleItemsInOrder() {
    List<FifoItem> queue = List.of(
        item("a", ""),
        item("b", "2025-11-25T13:00:00Z"),
        item("c", "2025-11-25T11:00:00Z"),
        item("d", "not a time"),
        item("e", ""));

    FifoBatch batch = ExpiryQueue.selectBatch(queue, 3, NOW);

    assertEquals(List.of(0, 2, 3), batch.indices());
    assertEquals("a", batch.items().get(0).id());
    assertEquals("c", batch.items().get(1).id());
    assertEquals("d", batch.items().get(2).id());
  }

  @Test
  void selectBatchSkipsNullsAndDeadItems() {
    FifoItem dead = new FifoItem("dead", "dead@x.com", "", "", List.of(), 5, "", "boom", "", null, true);
    List<FifoItem> queue = Arrays.asList(null, dead, item("a", ""));

    FifoBatch batch = ExpiryQueue.selectBatch(queue, 10, NOW);

    assertEquals(List.of(2), batch.indices());
  }

  @Test
  void selectBatchIncludesItemDueExactlyNow() {
    FifoBatch batch = ExpiryQueue.selectBatch(List.of(item("a", NOW.toString())), 1, NOW);

    assertEquals(1, batch.items().size());
  }

  @Test
  void selectBatchRejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> ExpiryQueue.selectBatch(List.of(), 0, NOW));
  }

  @Test
  void rebuildQueueReplacesRetriesAndDropsCompleted() {
    List<FifoItem> queue = List.of(item("a", ""), item("b", "2025-11-26T00:00:00Z"), item("c", ""));
    FifoItem retryC = item("c", "").withFailure(NOW, "boom", NOW.plusSeconds(60), false);

    List<FifoItem> rebuilt = ExpiryQueue.rebuildQueue(queue, List.of(0, 2), List.of(retryC));

    assertEquals(2, rebuilt.size());
    assertEquals("b", rebuilt.get(0).id());
    assertEquals(retryC, rebuilt.get(1));
  }

  @Test
  void rebuildQueueKeepsUnselectedNulls() {
    List<FifoItem> queue = new ArrayList<>(Arrays.asList(item("a", ""), null));

    List<FifoItem> rebuilt = ExpiryQueue.rebuildQueue(queue, List.of(0), List.of());

    assertEquals(1, rebuilt.size());
    assertNull(rebuilt.get(0));
  }

  @Test
  void assignNextBatchTimestampsStampsFirstEligibleItems() {
    Instant nextTrigger = Instant.parse("2025-11-25T12:01:00Z");
    List<FifoItem> queue = List.of(
        item("a", "2025-11-25T15:00:00Z"),
        item("b", ""),
        item("c", ""),
        item("d", ""));

    List<FifoItem> stamped = ExpiryQueue.assignNextBatchTimestamps(queue, 2, NOW, nextTrigger);

    assertEquals("2025-11-25T15:00:00Z", stamped.get(0).nextAttemptAt());
    assertEquals("2025-11-25T12:01:00Z", stamped.get(1).nextAttemptAt());
    assertEquals("2025-11-25T12:01:00Z", stamped.get(2).nextAttemptAt());
    assertEquals("", stamped.get(3).nextAttemptAt());
    assertEquals("", queue.get(1).nextAttemptAt());
  }
}
