package membership;

import membership.model.ActionSpec;
import membership.model.ActionSpecs;
import membership.model.ActionType;
import membership.model.Member;
import membership.model.MemberStatus;
import membership.model.Transaction;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared test data.
 */
public final class Fixtures {
    public static final LocalDate TODAY = LocalDate.of(2025, 6, 15);
    public static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final String GROUP_A = "members@club.org";
    public static final String GROUP_B = "announce@club.org";

    private Fixtures() {}

    public static List<ActionSpec> specList() {
        return List.of(
                ActionSpec.of(ActionType.JOIN, "Welcome {First}", "<p>Expires {Expires}</p>"),
                ActionSpec.of(ActionType.RENEW, "Renewed {First}", "<p>Expires {Expires}</p>"),
                ActionSpec.of(ActionType.MIGRATE, "Migrated {First}", "<p>Joined {Joined}</p>"),
                ActionSpec.expiry(ActionType.EXPIRY1, "Expiring soon", "<p>{First}, expires {Expires}</p>", -10),
                ActionSpec.expiry(ActionType.EXPIRY2, "Expiring very soon", "<p>{First}, expires {Expires}</p>", -5),
                ActionSpec.expiry(ActionType.EXPIRY3, "Expires today", "<p>{First}</p>", 0),
                ActionSpec.expiry(ActionType.EXPIRY4, "Expired", "<p>Goodbye {First}</p>", 10));
    }

    public static ActionSpecs specs() {
        return ActionSpecs.of(specList());
    }

    public static Member member(String email, String first, String last, String phone,
            LocalDate joined, LocalDate expires) {
        return Member.builder()
                .email(email)
                .first(first)
                .last(last)
                .phone(phone)
                .joined(joined)
                .expires(expires)
                .period(1)
                .status(MemberStatus.ACTIVE)
                .build();
    }

    public static Transaction paid(String email, String first, String last, String phone, String payment) {
        return new Transaction(email, first, last, phone, payment, "Share Name, Share Email", "Paid", null);
    }
}
