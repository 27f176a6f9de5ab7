package membership.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A row from the legacy member list being imported.
 *
 * <p>Rows flagged {@code migrateMe} with no {@code migrated} date are imported on the
 * next migration run; {@code groups} lists the addresses of groups the member
 * belonged to in the legacy system.
 */
public record MigratingMember(
        String email,
        String first,
        String last,
        String phone,
        LocalDate joined,
        int period,
        LocalDate expires,
        LocalDate renewedOn,
        boolean directory,
        MemberStatus status,
        boolean migrateMe,
        LocalDate migrated,
        List<String> groups) {

    public MigratingMember {
        email = email == null ? "" : email.trim();
        first = first == null ? "" : first.trim();
        last = last == null ? "" : last.trim();
        phone = phone == null ? "" : phone.trim();
        status = status == null ? MemberStatus.ACTIVE : status;
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public boolean isPendingMigration() {
        return migrateMe && migrated == null;
    }

    public MigratingMember withMigrated(LocalDate date) {
        return new MigratingMember(email, first, last, phone, joined, period, expires, renewedOn,
                directory, status, migrateMe, date, groups);
    }

    /** Converts the import row into a member row. A single directory flag grants all sharing. */
    public Member toMember() {
        return Member.builder()
                .email(email)
                .first(first)
                .last(last)
                .phone(phone)
                .joined(joined)
                .expires(expires)
                .period(period)
                .renewedOn(renewedOn)
                .status(status)
                .directory(directory ? DirectorySharing.ALL : DirectorySharing.NONE)
                .migrated(migrated)
                .build();
    }
}
