package membership.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the membership stores.
 */
public final class MembershipStoreException extends RuntimeException {
  public MembershipStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
