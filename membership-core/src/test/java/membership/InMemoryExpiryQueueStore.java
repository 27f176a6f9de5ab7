package membership;

import membership.model.FifoItem;
import membership.spi.ExpiryQueueStore;

import java.util.ArrayList;
import java.util.List;

/**
 * List-backed {@link ExpiryQueueStore} for tests.
 */
public class InMemoryExpiryQueueStore implements ExpiryQueueStore {
    public List<FifoItem> queue = new ArrayList<>();
    public final List<FifoItem> deadLetters = new ArrayList<>();

    @Override
    public List<FifoItem> loadQueue() {
        return new ArrayList<>(queue);
    }

    @Override
    public void saveQueue(List<FifoItem> queue) {
        this.queue = new ArrayList<>(queue);
    }

    @Override
    public void appendDeadLetters(List<FifoItem> items) {
        deadLetters.addAll(items);
    }

    @Override
    public List<FifoItem> loadDeadLetters() {
        return new ArrayList<>(deadLetters);
    }
}
