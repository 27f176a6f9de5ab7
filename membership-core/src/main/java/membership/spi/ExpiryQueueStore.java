package membership.spi;

import membership.model.FifoItem;

import java.util.List;

/**
 * Persistence for the expiry FIFO queue and its dead-letter list.
 */
public interface ExpiryQueueStore {

    /**
     * Loads the queue in FIFO order.
     */
    List<FifoItem> loadQueue();

    /**
     * Replaces the stored queue with {@code queue}, keeping order.
     */
    void saveQueue(List<FifoItem> queue);

    /**
     * Appends items that exhausted their attempts to the dead-letter list.
     */
    void appendDeadLetters(List<FifoItem> items);

    /**
     * Loads the dead-letter list in the order items were appended.
     */
    List<FifoItem> loadDeadLetters();
}
