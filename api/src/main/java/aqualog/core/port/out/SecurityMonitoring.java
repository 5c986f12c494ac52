package aqualog.core.port.out;

import java.time.Instant;

/**
 * Port interface for security monitoring.
 *
 * <p>Implementations turn authentication and authorization outcomes into
 * security events for logging, metrics and alerting.
 */
public interface SecurityMonitoring {

    /**
     * Check if security monitoring is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a failed login.
     *
     * @param username     the submitted username
     * @param reason       the failure reason code
     * @param failureCount the account's failure counter after this attempt
     */
    void recordAuthFailure(String username, String reason, int failureCount);

    /**
     * Record that an account has been locked.
     *
     * @param username       the locked account
     * @param failedAttempts the failure counter at lock time
     * @param lockedUntil    end of the lockout
     */
    void recordLockout(String username, int failedAttempts, Instant lockedUntil);

    /**
     * Record an operation refused by the capability gate.
     *
     * @param username   the caller, or null when unauthenticated
     * @param capability the missing capability
     * @param operation  the refused operation
     */
    void recordAccessDenied(String username, String capability, String operation);

    /**
     * Record a session invalidation.
     *
     * @param username the session owner
     * @param reason   the invalidation reason
     */
    void recordSessionInvalidation(String username, String reason);

    /**
     * Record an administrative change to an account.
     *
     * @param actor  the acting administrator
     * @param action the action name
     * @param target the affected username
     */
    void recordAdministrativeAction(String actor, String action, String target);
}
