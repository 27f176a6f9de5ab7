package membership.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A pending expiry reminder: send {@code type} to {@code email} on {@code date}.
 */
public record ScheduleEntry(String email, ActionType type, LocalDate date) {

    public ScheduleEntry {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(date, "date");
        if (!type.isExpiry()) {
            throw new IllegalArgumentException("schedule entries must be expiry actions, got: " + type);
        }
    }
}
