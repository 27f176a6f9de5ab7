package membership.spi;

import java.util.List;
import java.util.Map;

/**
 * Side channel for transactions that matched several members and need manual review.
 *
 * <p>Rows are keyed by column name; see
 * {@link membership.model.AmbiguousTransaction#toRow()}.
 */
@FunctionalInterface
public interface AmbiguousTransactionStore {

    /**
     * Replaces the stored review rows with the transactions currently awaiting review.
     * Each reconciliation run passes its full ambiguous set, so a transaction left
     * unprocessed across runs is stored once.
     *
     * @param rows the current rows; empty clears the store
     */
    void write(List<Map<String, String>> rows);
}
