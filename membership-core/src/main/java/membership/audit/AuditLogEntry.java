package membership.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * One append-only audit record.
 *
 * @param timestamp when the audited action happened
 * @param type      action type, for example {@code "Join"} or {@code "DeadLetter"}
 * @param outcome   success or failure
 * @param note      human-readable description
 * @param error     error message, empty on success
 * @param json      structured detail as a JSON object
 */
public record AuditLogEntry(
        Instant timestamp,
        String type,
        AuditOutcome outcome,
        String note,
        String error,
        String json) {

    public AuditLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(outcome, "outcome");
        note = note == null ? "" : note;
        error = error == null ? "" : error;
        json = json == null ? "{}" : json;
    }
}
