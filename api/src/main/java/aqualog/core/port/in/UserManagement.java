package aqualog.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.Capability;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserSummary;

/**
 * Inbound port for administrative user management.
 *
 * <p>Every operation takes the calling {@link Identity} and requires the
 * {@link Capability#ADMIN} capability. Failures are reported verbatim to the
 * caller, who is already privileged.
 *
 * <p>An administrator cannot delete, deactivate or demote their own account,
 * and the last active administrator cannot be deleted, deactivated or demoted.
 * Deactivating, deleting or changing the role of a user ends that user's
 * sessions.
 */
public interface UserManagement {

    /**
     * Create a user.
     *
     * @param caller      the calling administrator
     * @param username    new username (unique, case-insensitively)
     * @param password    initial password
     * @param role        account role
     * @param displayName optional display name
     * @param email       optional contact address
     * @return the created account
     * @throws DuplicateUsernameException if the username is taken
     * @throws InvalidInputException      if any argument fails validation
     */
    Uni<UserSummary> createUser(
            Identity caller, String username, String password, Role role, String displayName, String email);

    /**
     * Set a user's password. Also clears the failure counter and any lockout.
     *
     * @throws UserNotFoundException if the user does not exist
     * @throws InvalidInputException if the password fails validation
     */
    Uni<Void> changePassword(Identity caller, String username, String newPassword);

    /**
     * Change a user's role.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    Uni<UserSummary> changeRole(Identity caller, String username, Role role);

    /**
     * Allow a deactivated user to log in again.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    Uni<UserSummary> activate(Identity caller, String username);

    /**
     * Prevent a user from logging in, regardless of credentials.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    Uni<UserSummary> deactivate(Identity caller, String username);

    /**
     * Clear a user's lockout and failure counter.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    Uni<UserSummary> unlock(Identity caller, String username);

    /**
     * List all users, sorted by username.
     */
    Uni<List<UserSummary>> listUsers(Identity caller);

    /**
     * Look up a single user by exact username.
     */
    Uni<Optional<UserSummary>> getUser(Identity caller, String username);

    /**
     * Delete a user.
     *
     * @throws UserNotFoundException if the user does not exist
     */
    Uni<Void> deleteUser(Identity caller, String username);

    /**
     * Exception thrown when a username is already taken.
     */
    class DuplicateUsernameException extends RuntimeException {
        private final String username;

        public DuplicateUsernameException(String username) {
            super("Username already exists: " + username);
            this.username = username;
        }

        public String getUsername() {
            return username;
        }
    }

    /**
     * Exception thrown when a user does not exist.
     */
    class UserNotFoundException extends RuntimeException {
        private final String username;

        public UserNotFoundException(String username) {
            super("User not found: " + username);
            this.username = username;
        }

        public String getUsername() {
            return username;
        }
    }

    /**
     * Exception thrown when input fails validation or an operation would leave
     * the store in an invalid state.
     */
    class InvalidInputException extends RuntimeException {
        public InvalidInputException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when the caller lacks the required capability.
     */
    class AccessDeniedException extends RuntimeException {
        private final Capability required;

        public AccessDeniedException(Capability required, String operation) {
            super("Operation '" + operation + "' requires " + required + " capability");
            this.required = required;
        }

        public Capability getRequired() {
            return required;
        }
    }
}
