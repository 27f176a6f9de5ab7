package membership.audit;

/**
 * Outcome recorded on an audit entry.
 */
public enum AuditOutcome {
    SUCCESS("success"),
    FAIL("fail");

    private final String label;

    AuditOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AuditOutcome fromLabel(String label) {
        for (AuditOutcome outcome : values()) {
            if (outcome.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown audit outcome: " + label);
    }
}
