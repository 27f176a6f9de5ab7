package membership.audit;

import membership.util.JsonCodec;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Creates validated {@link AuditLogEntry} instances stamped with the current time.
 *
 * <p>Entries are only created here; persisting them is the job of an
 * {@link membership.spi.AuditSink}.
 */
public final class AuditLogger {
  private final Clock clock;
  private final JsonCodec jsonCodec;

  public AuditLogger(Clock clock) {
    this(clock, JsonCodec.getDefault());
  }

  public AuditLogger(Clock clock, JsonCodec jsonCodec) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Creates an entry.
   *
   * @param type    non-blank action type
   * @param outcome success or failure
   * @param note    description, may be {@code null}
   * @param error   error message, may be {@code null}
   * @param data    structured detail serialized to the entry's JSON column, may be {@code null}
   * @return the new entry
   * @throws IllegalArgumentException if {@code type} is blank
   */
  public AuditLogEntry createLogEntry(String type, AuditOutcome outcome, String note,
      String error, Map<String, String> data) {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("audit entry type cannot be blank");
    }
    Objects.requireNonNull(outcome, "outcome");
    return new AuditLogEntry(clock.instant(), type.trim(), outcome, note, error,
        jsonCodec.toJson(data));
  }

  public AuditLogEntry success(String type, String note, Map<String, String> data) {
    return createLogEntry(type, AuditOutcome.SUCCESS, note, null, data);
  }

  public AuditLogEntry failure(String type, String note, String error, Map<String, String> data) {
    return createLogEntry(type, AuditOutcome.FAIL, note, error, data);
  }
}
