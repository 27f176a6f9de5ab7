package membership.spi;

import membership.audit.AuditLogEntry;

import java.util.List;

/**
 * Append-only destination for audit log entries.
 */
@FunctionalInterface
public interface AuditSink {

    /** Sink that drops every entry. */
    AuditSink NOOP = entries -> { };

    /**
     * Appends the entries in order. An empty list is a no-op.
     *
     * @param entries entries to append
     */
    void persist(List<AuditLogEntry> entries);
}
