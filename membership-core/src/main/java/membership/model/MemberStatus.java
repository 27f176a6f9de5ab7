package membership.model;

/**
 * Lifecycle status of a membership row.
 */
public enum MemberStatus {
    ACTIVE("Active"),
    EXPIRED("Expired");

    private final String label;

    MemberStatus(String label) {
        this.label = label;
    }

    /**
     * Returns the label stored in the member sheet ({@code "Active"} or {@code "Expired"}).
     *
     * @return the stored label
     */
    public String label() {
        return label;
    }

    /**
     * Parses a stored status label, case-insensitively.
     *
     * @param label the stored label
     * @return the matching status
     * @throws IllegalArgumentException if the label is not a known status
     */
    public static MemberStatus fromLabel(String label) {
        for (MemberStatus status : values()) {
            if (status.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown member status: " + label);
    }
}
