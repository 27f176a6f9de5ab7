package membership.model;

/**
 * A per-row failure collected during a batch run. Row numbers are sheet rows
 * (index + 2, accounting for the header row).
 */
public record RowError(int rowNumber, String email, String message) {

    @Override
    public String toString() {
        return "Row " + rowNumber + " (" + email + "): " + message;
    }
}
