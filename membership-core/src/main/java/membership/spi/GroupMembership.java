package membership.spi;

/**
 * Adds and removes members from mailing groups, identified by group email address.
 *
 * <p>Add and remove may throw; callers record the failure and retry or report it.
 */
public interface GroupMembership {

    /**
     * Subscribes {@code email} to {@code group}.
     *
     * @throws Exception if the group service rejected or failed the request
     */
    void addToGroup(String email, String group) throws Exception;

    /**
     * Unsubscribes {@code email} from {@code group}.
     *
     * @throws Exception if the group service rejected or failed the request
     */
    void removeFromGroup(String email, String group) throws Exception;

    /**
     * Replaces {@code oldEmail} with {@code newEmail} in every group it belongs to.
     *
     * <p>The default reports that the operation is unsupported.
     *
     * @return the outcome; never {@code null}
     * @throws Exception if the group service failed
     */
    default GroupChangeResult replaceEmailInGroups(String oldEmail, String newEmail) throws Exception {
        return GroupChangeResult.failure("Group email replacement is not supported");
    }

    /**
     * Outcome of a group-wide email replacement.
     *
     * @param success whether every group was updated
     * @param message detail for logs, empty on success
     */
    record GroupChangeResult(boolean success, String message) {

        public static GroupChangeResult ok() {
            return new GroupChangeResult(true, "");
        }

        public static GroupChangeResult failure(String message) {
            return new GroupChangeResult(false, message == null ? "" : message);
        }
    }
}
