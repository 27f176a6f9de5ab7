package membership.queue;

import membership.audit.AuditLogEntry;
import membership.model.FifoItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one queue drain.
 *
 * @param queue        the next queue, to persist; may hold the nulls it was given
 * @param delivered    items that completed every side effect
 * @param retried      items rescheduled after a failure
 * @param dead         items that exhausted their attempts
 * @param auditEntries dead-letter audit entries
 */
public record QueueRunResult(
    List<FifoItem> queue,
    int delivered,
    int retried,
    List<FifoItem> dead,
    List<AuditLogEntry> auditEntries) {

  public QueueRunResult {
    queue = Collections.unmodifiableList(new ArrayList<>(queue));
    dead = List.copyOf(dead);
    auditEntries = List.copyOf(auditEntries);
  }
}
