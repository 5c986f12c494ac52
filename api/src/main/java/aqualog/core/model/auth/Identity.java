package aqualog.core.model.auth;

/**
 * The authenticated principal produced by a successful login.
 *
 * @param username    account username
 * @param role        account role at the time of login
 * @param displayName name to show; defaults to the username
 */
public record Identity(String username, Role role, String displayName) {

    public Identity {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = username;
        }
    }
}
