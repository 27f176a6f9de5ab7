package membership.queue;

import membership.model.ExpiryNotification;
import membership.model.FifoItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ExpiryQueue#enqueue}.
 *
 * @param queue    the queue with every accepted notification appended
 * @param rejected notifications that could not become queue items
 */
public record EnqueueResult(List<FifoItem> queue, List<Rejected> rejected) {

  public EnqueueResult {
    queue = Collections.unmodifiableList(new ArrayList<>(queue));
    rejected = List.copyOf(rejected);
  }

  /** A notification that failed item validation, with the reason. */
  public record Rejected(ExpiryNotification notification, String reason) {

    public Rejected {
      Objects.requireNonNull(notification, "notification");
      reason = reason == null ? "" : reason;
    }
  }
}
