package membership.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A paid transaction that matched more than one active member and was left for
 * manual review.
 *
 * @param rowNumber  sheet row of the transaction (index + 2)
 * @param transaction snapshot of the transaction
 * @param candidates member row indices that matched
 */
public record AmbiguousTransaction(int rowNumber, Transaction transaction, List<Integer> candidates) {

    public static final String ROW = "Row";
    public static final String EMAIL = "Email";
    public static final String CANDIDATES = "Candidates";

    public AmbiguousTransaction {
        Objects.requireNonNull(transaction, "transaction");
        candidates = List.copyOf(candidates);
    }

    /**
     * Returns a flat row for the review sheet: row number, email, the transaction's
     * columns and the comma-joined candidate indices.
     */
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(ROW, Integer.toString(rowNumber));
        row.put(EMAIL, transaction.emailAddress());
        row.putAll(transaction.toRow());
        row.put(CANDIDATES, candidates.stream().map(String::valueOf).collect(Collectors.joining(",")));
        return row;
    }
}
