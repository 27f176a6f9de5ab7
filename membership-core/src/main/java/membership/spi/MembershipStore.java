package membership.spi;

import membership.model.ActionSpec;
import membership.model.Member;
import membership.model.MigratingMember;
import membership.model.ScheduleEntry;
import membership.model.Transaction;

import java.util.List;

/**
 * Persistence for the membership sheets.
 *
 * <p>Each {@code save} replaces the stored collection with the given list, keeping
 * list order. Loads return rows in stored order, which defines the row numbers used
 * in error reports.
 */
public interface MembershipStore {

    List<Member> loadMembers();

    void saveMembers(List<Member> members);

    List<Transaction> loadTransactions();

    void saveTransactions(List<Transaction> transactions);

    List<ScheduleEntry> loadSchedule();

    void saveSchedule(List<ScheduleEntry> schedule);

    List<MigratingMember> loadMigrators();

    void saveMigrators(List<MigratingMember> migrators);

    /**
     * Loads the configured message templates and expiry offsets.
     *
     * @return all configured action specs
     */
    List<ActionSpec> loadActionSpecs();
}
