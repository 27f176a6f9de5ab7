package membership.queue;

import membership.model.FifoItem;

import java.util.List;

/**
 * Items selected for one drain, with their positions in the queue.
 */
public record FifoBatch(List<FifoItem> items, List<Integer> indices) {

  public FifoBatch {
    items = List.copyOf(items);
    indices = List.copyOf(indices);
    if (items.size() != indices.size()) {
      throw new IllegalArgumentException("items and indices must have the same size");
    }
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
