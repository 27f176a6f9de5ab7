package membership.model;

import java.util.Objects;

/**
 * An outgoing email message handed to the notification sender.
 */
public record Notification(String to, String subject, String htmlBody) {

    public Notification {
        Objects.requireNonNull(to, "to");
        subject = subject == null ? "" : subject;
        htmlBody = htmlBody == null ? "" : htmlBody;
    }
}
