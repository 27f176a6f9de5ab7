package membership.model;

import java.util.Objects;

/**
 * Configuration of one member-facing action: the message template and, for expiry
 * reminders, the day offset relative to the member's expiry date.
 *
 * <p>Subject and body may contain {@code {Field}} placeholders that are expanded
 * against the member's fields.
 *
 * @param type    the action this spec configures
 * @param subject subject template (never {@code null})
 * @param body    HTML body template (never {@code null})
 * @param offset  days relative to {@code Expires}; {@code null} for non-expiry actions
 */
public record ActionSpec(ActionType type, String subject, String body, Integer offset) {

    public ActionSpec {
        Objects.requireNonNull(type, "type");
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
    }

    public static ActionSpec of(ActionType type, String subject, String body) {
        return new ActionSpec(type, subject, body, null);
    }

    public static ActionSpec expiry(ActionType type, String subject, String body, int offset) {
        if (!type.isExpiry()) {
            throw new IllegalArgumentException("offset only applies to expiry actions, got: " + type);
        }
        return new ActionSpec(type, subject, body, offset);
    }
}
