package membership.model;

import java.util.List;

/**
 * Kinds of member-facing actions, each configured by an {@link ActionSpec}.
 *
 * <p>{@code EXPIRY1} through {@code EXPIRY4} are the staged expiry reminders;
 * {@code EXPIRY4} is the terminal step that expires the member.
 */
public enum ActionType {
    JOIN("Join"),
    RENEW("Renew"),
    MIGRATE("Migrate"),
    EXPIRY1("Expiry1"),
    EXPIRY2("Expiry2"),
    EXPIRY3("Expiry3"),
    EXPIRY4("Expiry4");

    /** Expiry reminder types in the order they fall due. */
    public static final List<ActionType> EXPIRIES = List.of(EXPIRY1, EXPIRY2, EXPIRY3, EXPIRY4);

    private final String label;

    ActionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isExpiry() {
        return EXPIRIES.contains(this);
    }

    public boolean isTerminal() {
        return this == EXPIRY4;
    }

    /**
     * Parses a stored type label such as {@code "Expiry2"}, case-insensitively.
     *
     * @param label the stored label
     * @return the matching type
     * @throws IllegalArgumentException if the label is not a known type
     */
    public static ActionType fromLabel(String label) {
        for (ActionType type : values()) {
            if (type.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + label);
    }
}
