package aqualog.core.model.auth;

/**
 * Reasons a login can be refused.
 *
 * <p>An unknown username and a wrong password both map to
 * {@link #INVALID_CREDENTIALS} so the caller cannot enumerate accounts.
 */
public enum AuthError {
    INVALID_CREDENTIALS("invalid_credentials", "Invalid username or password"),
    ACCOUNT_DISABLED("account_disabled", "This account has been disabled. Contact an administrator."),
    ACCOUNT_LOCKED("account_locked", "Too many failed attempts. Try again later.");

    private final String code;
    private final String userMessage;

    AuthError(String code, String userMessage) {
        this.code = code;
        this.userMessage = userMessage;
    }

    /**
     * Stable code used in logs and metrics tags.
     */
    public String code() {
        return code;
    }

    /**
     * Message safe to show on a login form.
     */
    public String userMessage() {
        return userMessage;
    }
}
