package membership;

import membership.model.ActionSpec;
import membership.model.Member;
import membership.model.MigratingMember;
import membership.model.ScheduleEntry;
import membership.model.Transaction;
import membership.spi.MembershipStore;

import java.util.ArrayList;
import java.util.List;

/**
 * List-backed {@link MembershipStore} for tests.
 */
public class InMemoryMembershipStore implements MembershipStore {
    public List<Member> members = new ArrayList<>();
    public List<Transaction> transactions = new ArrayList<>();
    public List<ScheduleEntry> schedule = new ArrayList<>();
    public List<MigratingMember> migrators = new ArrayList<>();
    public List<ActionSpec> actionSpecs = new ArrayList<>(Fixtures.specList());
    public int saves;

    @Override
    public List<Member> loadMembers() {
        return new ArrayList<>(members);
    }

    @Override
    public void saveMembers(List<Member> members) {
        this.members = new ArrayList<>(members);
        saves++;
    }

    @Override
    public List<Transaction> loadTransactions() {
        return new ArrayList<>(transactions);
    }

    @Override
    public void saveTransactions(List<Transaction> transactions) {
        this.transactions = new ArrayList<>(transactions);
        saves++;
    }

    @Override
    public List<ScheduleEntry> loadSchedule() {
        return new ArrayList<>(schedule);
    }

    @Override
    public void saveSchedule(List<ScheduleEntry> schedule) {
        this.schedule = new ArrayList<>(schedule);
        saves++;
    }

    @Override
    public List<MigratingMember> loadMigrators() {
        return new ArrayList<>(migrators);
    }

    @Override
    public void saveMigrators(List<MigratingMember> migrators) {
        this.migrators = new ArrayList<>(migrators);
        saves++;
    }

    @Override
    public List<ActionSpec> loadActionSpecs() {
        return new ArrayList<>(actionSpecs);
    }
}
