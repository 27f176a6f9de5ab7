package membership.reconcile;

import membership.model.AmbiguousTransaction;
import membership.model.Member;
import membership.model.Notification;
import membership.model.RowError;
import membership.model.ScheduleEntry;
import membership.model.Transaction;

import java.util.List;

/**
 * Output of one reconciliation run. The lists are updated copies of the inputs.
 *
 * @param transactions          transactions, with consumed ones marked processed
 * @param members               member rows after joins and renewals
 * @param schedule              expiry schedule after joins and renewals
 * @param recordsChanged        whether any member or schedule change was applied
 * @param hasPendingPayments    whether any transaction was left for a later run
 * @param errors                per-transaction failures
 * @param ambiguousTransactions transactions set aside for manual review
 * @param notifications         join and renewal messages that were sent
 * @param joined                number of new members
 * @param renewed               number of renewals
 */
public record ReconciliationResult(
    List<Transaction> transactions,
    List<Member> members,
    List<ScheduleEntry> schedule,
    boolean recordsChanged,
    boolean hasPendingPayments,
    List<RowError> errors,
    List<AmbiguousTransaction> ambiguousTransactions,
    List<Notification> notifications,
    int joined,
    int renewed) {

  public ReconciliationResult {
    transactions = List.copyOf(transactions);
    members = List.copyOf(members);
    schedule = List.copyOf(schedule);
    errors = List.copyOf(errors);
    ambiguousTransactions = List.copyOf(ambiguousTransactions);
    notifications = List.copyOf(notifications);
  }
}
