package membership.spi;

import membership.model.Notification;

/**
 * Sends member-facing email.
 *
 * <p>Implementations may throw any exception; callers treat a thrown exception as
 * a failed send and decide whether to retry.
 */
@FunctionalInterface
public interface NotificationSender {

    /**
     * Sends one message.
     *
     * @param notification the message to send
     * @throws Exception if the message could not be sent
     */
    void send(Notification notification) throws Exception;
}
