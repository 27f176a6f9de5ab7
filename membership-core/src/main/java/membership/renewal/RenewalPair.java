package membership.renewal;

/**
 * Two member rows that look like one person joining twice: {@code initial} joined
 * first and {@code latest} joined before {@code initial} expired.
 */
public record RenewalPair(int initial, int latest) {
}
