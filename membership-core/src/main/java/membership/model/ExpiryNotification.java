package membership.model;

import java.util.List;
import java.util.Objects;

/**
 * Side-effect payload for a due expiry reminder: the message to send and, for the
 * terminal reminder, the groups the member must be removed from.
 */
public record ExpiryNotification(String email, String subject, String htmlBody, List<String> groups) {

    public ExpiryNotification {
        Objects.requireNonNull(email, "email");
        subject = subject == null ? "" : subject;
        htmlBody = htmlBody == null ? "" : htmlBody;
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
