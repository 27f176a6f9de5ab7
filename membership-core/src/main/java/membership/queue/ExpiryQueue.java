package membership.queue;

import membership.model.ExpiryNotification;
import membership.model.FifoItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure helpers over the expiry FIFO queue. None of them modify their arguments.
 */
public final class ExpiryQueue {

  private ExpiryQueue() {}

  /**
   * Appends one new item per notification to the end of the queue. A notification
   * whose address fails item validation is rejected and the rest are still queued.
   */
  public static EnqueueResult enqueue(List<FifoItem> queue, List<ExpiryNotification> notifications) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(notifications, "notifications");
    List<FifoItem> updated = new ArrayList<>(queue);
    List<EnqueueResult.Rejected> rejected = new ArrayList<>();
    for (ExpiryNotification notification : notifications) {
      try {
        updated.add(FifoItem.of(notification));
      } catch (IllegalArgumentException e) {
        rejected.add(new EnqueueResult.Rejected(notification, e.getMessage()));
      }
    }
    return new EnqueueResult(updated, rejected);
  }

  /**
   * Selects up to {@code batchSize} eligible items in queue order. Null and dead
   * items are skipped; an item is eligible when its next attempt time is blank,
   * unparseable or not after {@code now}.
   *
   * @param queue     the queue
   * @param batchSize maximum items to select, at least 1
   * @param now       the current time
   * @return the selected items and their queue indices
   */
  public static FifoBatch selectBatch(List<FifoItem> queue, int batchSize, Instant now) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(now, "now");
    requirePositive(batchSize, "batchSize");
    List<FifoItem> items = new ArrayList<>();
    List<Integer> indices = new ArrayList<>();
    for (int i = 0; i < queue.size() && items.size() < batchSize; i++) {
      FifoItem item = queue.get(i);
      if (item != null && item.isEligibleAt(now)) {
        items.add(item);
        indices.add(i);
      }
    }
    return new FifoBatch(items, indices);
  }

  /**
   * Builds the queue for the next run. Unselected items stay in place. Each selected
   * item is replaced by the retry item with the same id, or dropped when there is
   * none because it completed or went dead.
   *
   * @param original        the queue the batch was selected from
   * @param selectedIndices indices of the selected items
   * @param retryItems      updated copies of items to try again
   * @return the next queue
   */
  public static List<FifoItem> rebuildQueue(List<FifoItem> original, List<Integer> selectedIndices,
      List<FifoItem> retryItems) {
    Objects.requireNonNull(original, "original");
    Objects.requireNonNull(selectedIndices, "selectedIndices");
    Objects.requireNonNull(retryItems, "retryItems");
    Set<Integer> selected = new HashSet<>(selectedIndices);
    Map<String, FifoItem> retriesById = new HashMap<>();
    for (FifoItem retry : retryItems) {
      retriesById.put(retry.id(), retry);
    }
    List<FifoItem> rebuilt = new ArrayList<>(original.size());
    for (int i = 0; i < original.size(); i++) {
      FifoItem item = original.get(i);
      if (!selected.contains(i)) {
        rebuilt.add(item);
      } else if (item != null && retriesById.containsKey(item.id())) {
        rebuilt.add(retriesById.get(item.id()));
      }
    }
    return rebuilt;
  }

  /**
   * Stamps the first {@code batchSize} currently eligible items with
   * {@code nextTriggerTime} so the next run picks them up.
   *
   * @return a new queue; items beyond the batch are unchanged
   */
  public static List<FifoItem> assignNextBatchTimestamps(List<FifoItem> queue, int batchSize, Instant now,
      Instant nextTriggerTime) {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(nextTriggerTime, "nextTriggerTime");
    requirePositive(batchSize, "batchSize");
    List<FifoItem> stamped = new ArrayList<>(queue.size());
    int assigned = 0;
    for (FifoItem item : queue) {
      if (item != null && assigned < batchSize && item.isEligibleAt(now)) {
        stamped.add(item.withNextAttemptAt(nextTriggerTime.toString()));
        assigned++;
      } else {
        stamped.add(item);
      }
    }
    return stamped;
  }

  static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
    }
  }
}
