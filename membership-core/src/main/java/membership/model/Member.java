package membership.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One membership interval for a person.
 *
 * <p>At most one {@link MemberStatus#ACTIVE} row should exist per person; overlapping
 * active rows are resolved by the renewal detector. {@code renewedOn} and
 * {@code migrated} are {@code null} when unset.
 *
 * <p>Use {@link #builder()} or {@link #toBuilder()} to create modified copies.
 */
public record Member(
        String email,
        String first,
        String last,
        String phone,
        LocalDate joined,
        LocalDate expires,
        int period,
        LocalDate renewedOn,
        MemberStatus status,
        boolean directoryShareName,
        boolean directoryShareEmail,
        boolean directorySharePhone,
        LocalDate migrated) {

    public static final String EMAIL = "Email";
    public static final String FIRST = "First";
    public static final String LAST = "Last";
    public static final String PHONE = "Phone";
    public static final String JOINED = "Joined";
    public static final String EXPIRES = "Expires";
    public static final String PERIOD = "Period";
    public static final String RENEWED_ON = "Renewed On";
    public static final String STATUS = "Status";
    public static final String DIRECTORY_SHARE_NAME = "Directory Share Name";
    public static final String DIRECTORY_SHARE_EMAIL = "Directory Share Email";
    public static final String DIRECTORY_SHARE_PHONE = "Directory Share Phone";
    public static final String MIGRATED = "Migrated";

    public Member {
        email = email == null ? "" : email.trim();
        first = first == null ? "" : first.trim();
        last = last == null ? "" : last.trim();
        phone = phone == null ? "" : phone.trim();
        Objects.requireNonNull(status, "status");
        if (period < 0) {
            throw new IllegalArgumentException("period must be >= 0, got: " + period);
        }
    }

    public boolean isActive() {
        return status == MemberStatus.ACTIVE;
    }

    /**
     * Returns the member's fields keyed by their stored column names, in column order.
     * Unset dates map to {@code null}.
     *
     * @return unmodifiable field map
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(EMAIL, email);
        fields.put(FIRST, first);
        fields.put(LAST, last);
        fields.put(PHONE, phone);
        fields.put(JOINED, joined);
        fields.put(EXPIRES, expires);
        fields.put(PERIOD, period);
        fields.put(RENEWED_ON, renewedOn);
        fields.put(STATUS, status.label());
        fields.put(DIRECTORY_SHARE_NAME, directoryShareName);
        fields.put(DIRECTORY_SHARE_EMAIL, directoryShareEmail);
        fields.put(DIRECTORY_SHARE_PHONE, directorySharePhone);
        fields.put(MIGRATED, migrated);
        return Collections.unmodifiableMap(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .email(email)
                .first(first)
                .last(last)
                .phone(phone)
                .joined(joined)
                .expires(expires)
                .period(period)
                .renewedOn(renewedOn)
                .status(status)
                .directoryShareName(directoryShareName)
                .directoryShareEmail(directoryShareEmail)
                .directorySharePhone(directorySharePhone)
                .migrated(migrated);
    }

    /** Builder for {@link Member}. Status defaults to {@link MemberStatus#ACTIVE}, period to 1. */
    public static final class Builder {
        private String email;
        private String first;
        private String last;
        private String phone;
        private LocalDate joined;
        private LocalDate expires;
        private int period = 1;
        private LocalDate renewedOn;
        private MemberStatus status = MemberStatus.ACTIVE;
        private boolean directoryShareName;
        private boolean directoryShareEmail;
        private boolean directorySharePhone;
        private LocalDate migrated;

        private Builder() {}

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder first(String first) {
            this.first = first;
            return this;
        }

        public Builder last(String last) {
            this.last = last;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder joined(LocalDate joined) {
            this.joined = joined;
            return this;
        }

        public Builder expires(LocalDate expires) {
            this.expires = expires;
            return this;
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder renewedOn(LocalDate renewedOn) {
            this.renewedOn = renewedOn;
            return this;
        }

        public Builder status(MemberStatus status) {
            this.status = status;
            return this;
        }

        public Builder directoryShareName(boolean directoryShareName) {
            this.directoryShareName = directoryShareName;
            return this;
        }

        public Builder directoryShareEmail(boolean directoryShareEmail) {
            this.directoryShareEmail = directoryShareEmail;
            return this;
        }

        public Builder directorySharePhone(boolean directorySharePhone) {
            this.directorySharePhone = directorySharePhone;
            return this;
        }

        public Builder directory(DirectorySharing sharing) {
            this.directoryShareName = sharing.name();
            this.directoryShareEmail = sharing.email();
            this.directorySharePhone = sharing.phone();
            return this;
        }

        public Builder migrated(LocalDate migrated) {
            this.migrated = migrated;
            return this;
        }

        public Member build() {
            return new Member(email, first, last, phone, joined, expires, period, renewedOn,
                    status, directoryShareName, directoryShareEmail, directorySharePhone, migrated);
        }
    }
}
