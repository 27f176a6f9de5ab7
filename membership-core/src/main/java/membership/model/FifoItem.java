package membership.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A queued expiry side effect with its retry bookkeeping.
 *
 * <p>{@code lastAttemptAt} and {@code nextAttemptAt} are ISO-8601 instants stored as
 * text; an empty {@code nextAttemptAt} means "eligible now". {@code groups} holds the
 * group addresses still to be left and shrinks as removals succeed. {@code maxAttempts}
 * overrides the processor's limit for this item when non-null.
 *
 * <p>Instances are validated on construction: the id must be non-blank, the email
 * must look like an address and {@code attempts} must be non-negative.
 */
public record FifoItem(
        String id,
        String email,
        String subject,
        String htmlBody,
        List<String> groups,
        int attempts,
        String lastAttemptAt,
        String lastError,
        String nextAttemptAt,
        Integer maxAttempts,
        boolean dead) {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public FifoItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
        id = id.trim();
        email = email.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            throw new IllegalArgumentException("Invalid email address: " + email);
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        subject = subject == null ? "" : subject;
        htmlBody = htmlBody == null ? "" : htmlBody;
        groups = groups == null ? List.of() : List.copyOf(groups);
        lastAttemptAt = lastAttemptAt == null ? "" : lastAttemptAt.trim();
        lastError = lastError == null ? "" : lastError;
        nextAttemptAt = nextAttemptAt == null ? "" : nextAttemptAt.trim();
    }

    /**
     * Creates a fresh item for a generated expiry notification, with a new ULID id.
     *
     * @param notification the payload
     * @return a new item with zero attempts
     */
    public static FifoItem of(ExpiryNotification notification) {
        return new FifoItem(UlidCreator.getMonotonicUlid().toString(), notification.email(),
                notification.subject(), notification.htmlBody(), notification.groups(),
                0, "", "", "", null, false);
    }

    /** Splits a stored comma-joined group list, dropping blanks. */
    public static List<String> parseGroups(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        List<String> groups = new ArrayList<>();
        for (String group : Arrays.asList(joined.split(","))) {
            if (!group.isBlank()) {
                groups.add(group.trim());
            }
        }
        return groups;
    }

    public String groupsAsString() {
        return String.join(",", groups);
    }

    public boolean hasMessage() {
        return !subject.isEmpty() && !htmlBody.isEmpty();
    }

    /**
     * Returns the parsed {@code nextAttemptAt}, or empty when it is blank or not a
     * valid instant.
     */
    public Optional<Instant> nextAttemptInstant() {
        if (nextAttemptAt.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(nextAttemptAt));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Eligible items are live and have no retry time in the future. */
    public boolean isEligibleAt(Instant now) {
        if (dead) {
            return false;
        }
        return nextAttemptInstant().map(next -> !next.isAfter(now)).orElse(true);
    }

    /** Copy with the message cleared once it has been sent. */
    public FifoItem withoutMessage() {
        return new FifoItem(id, email, "", "", groups, attempts, lastAttemptAt, lastError,
                nextAttemptAt, maxAttempts, dead);
    }

    public FifoItem withGroups(List<String> remaining) {
        return new FifoItem(id, email, subject, htmlBody, remaining, attempts, lastAttemptAt,
                lastError, nextAttemptAt, maxAttempts, dead);
    }

    public FifoItem withNextAttemptAt(String next) {
        return new FifoItem(id, email, subject, htmlBody, groups, attempts, lastAttemptAt,
                lastError, next, maxAttempts, dead);
    }

    /**
     * Copy recording a failed attempt.
     *
     * @param attemptedAt when the attempt ran
     * @param error       failure message
     * @param next        next attempt time, or {@code null} when the item is dead
     * @param isDead      whether the item has exhausted its attempts
     */
    public FifoItem withFailure(Instant attemptedAt, String error, Instant next, boolean isDead) {
        return new FifoItem(id, email, subject, htmlBody, groups, attempts + 1,
                attemptedAt.toString(), error, next == null ? "" : next.toString(),
                maxAttempts, isDead);
    }
}
