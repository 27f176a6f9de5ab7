package membership.model;

import java.util.Locale;

/**
 * Which contact details a member agreed to share in the member directory.
 *
 * @param name  share name
 * @param email share email address
 * @param phone share phone number
 */
public record DirectorySharing(boolean name, boolean email, boolean phone) {

    public static final DirectorySharing NONE = new DirectorySharing(false, false, false);
    public static final DirectorySharing ALL = new DirectorySharing(true, true, true);

    /**
     * Derives sharing flags from a free-text directory answer, for example
     * {@code "Share Name, Share Email"}. Matching is case-insensitive.
     *
     * @param directory the payment form's directory answer, may be {@code null}
     * @return the derived flags
     */
    public static DirectorySharing parse(String directory) {
        if (directory == null || directory.isBlank()) {
            return NONE;
        }
        String text = directory.toLowerCase(Locale.ROOT);
        return new DirectorySharing(
                text.contains("share name"),
                text.contains("share email"),
                text.contains("share phone"));
    }
}
