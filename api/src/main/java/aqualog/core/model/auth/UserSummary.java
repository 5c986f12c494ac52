package aqualog.core.model.auth;

import java.time.Instant;

/**
 * Administrative view of a user account without credential material.
 *
 * @param username       account username
 * @param displayName    display name, or the username when none is set
 * @param email          contact address (may be null)
 * @param role           account role
 * @param active         whether the account may log in
 * @param failedAttempts current failure counter
 * @param lockedUntil    end of the current lockout (may be null or in the past)
 * @param createdAt      creation time
 * @param lastLoginAt    last successful login (may be null)
 */
public record UserSummary(
        String username,
        String displayName,
        String email,
        Role role,
        boolean active,
        int failedAttempts,
        Instant lockedUntil,
        Instant createdAt,
        Instant lastLoginAt) {

    public static UserSummary from(UserRecord record) {
        return new UserSummary(
                record.username(),
                record.effectiveDisplayName(),
                record.email(),
                record.role(),
                record.active(),
                record.failedAttempts(),
                record.lockedUntil(),
                record.createdAt(),
                record.lastLoginAt());
    }
}
