package aqualog.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored user account.
 *
 * <p>The password is never held in plaintext: {@code passwordHash} is the
 * one-way digest of the password and {@code salt}, encrypted at rest. The salt
 * is generated once when the account is created and never changes.
 *
 * <p>Records are immutable. Every state transition returns a new record so a
 * repository can apply it as a single atomic replacement.
 *
 * @param username       unique, case-preserving identifier
 * @param displayName    optional human-readable name
 * @param email          optional contact address
 * @param passwordHash   encrypted password digest
 * @param salt           hex-encoded per-user salt
 * @param role           account role
 * @param active         false when the account has been deactivated
 * @param failedAttempts consecutive failed logins since the last success or unlock
 * @param lockedUntil    end of the current lockout, or null
 * @param createdAt      when the account was created
 * @param updatedAt      when the record last changed
 * @param lastLoginAt    last successful login, or null
 */
public record UserRecord(
        String username,
        String displayName,
        String email,
        String passwordHash,
        String salt,
        Role role,
        boolean active,
        int failedAttempts,
        Instant lockedUntil,
        Instant createdAt,
        Instant updatedAt,
        Instant lastLoginAt) {

    public UserRecord {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash cannot be null or blank");
        }
        if (salt == null || salt.isBlank()) {
            throw new IllegalArgumentException("Salt cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (failedAttempts < 0) {
            throw new IllegalArgumentException("Failed attempts cannot be negative");
        }
        if (displayName != null && displayName.isBlank()) {
            displayName = null;
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Check whether a lockout is in effect at the given instant.
     *
     * @param now the current time
     * @return true if {@code lockedUntil} is set and in the future
     */
    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /**
     * Time left on the current lockout.
     *
     * @param now the current time
     * @return remaining lockout, or {@link Duration#ZERO} if not locked
     */
    public Duration remainingLockout(Instant now) {
        return isLocked(now) ? Duration.between(now, lockedUntil) : Duration.ZERO;
    }

    /**
     * The name to show for this user, falling back to the username.
     */
    public String effectiveDisplayName() {
        return displayName != null ? displayName : username;
    }

    /**
     * The authenticated principal for this account.
     */
    public Identity toIdentity() {
        return new Identity(username, role, effectiveDisplayName());
    }

    public UserRecord withRole(Role newRole, Instant now) {
        return toBuilder().role(newRole).updatedAt(now).build();
    }

    public UserRecord withActive(boolean newActive, Instant now) {
        return toBuilder().active(newActive).updatedAt(now).build();
    }

    /**
     * Replace the password hash. The salt is kept; the failure counter and
     * any lockout are cleared.
     */
    public UserRecord withPasswordHash(String newPasswordHash, Instant now) {
        return toBuilder()
                .passwordHash(newPasswordHash)
                .failedAttempts(0)
                .lockedUntil(null)
                .updatedAt(now)
                .build();
    }

    public UserRecord withFailedAttempts(int newFailedAttempts, Instant newLockedUntil, Instant now) {
        return toBuilder()
                .failedAttempts(newFailedAttempts)
                .lockedUntil(newLockedUntil)
                .updatedAt(now)
                .build();
    }

    public UserRecord withSuccessfulLogin(Instant now) {
        return toBuilder()
                .failedAttempts(0)
                .lockedUntil(null)
                .lastLoginAt(now)
                .updatedAt(now)
                .build();
    }

    public UserRecord withUnlocked(Instant now) {
        return toBuilder().failedAttempts(0).lockedUntil(null).updatedAt(now).build();
    }

    @Override
    public String toString() {
        return "UserRecord[username=" + username
                + ", displayName=" + displayName
                + ", role=" + role
                + ", active=" + active
                + ", failedAttempts=" + failedAttempts
                + ", lockedUntil=" + lockedUntil
                + ", createdAt=" + createdAt
                + ", lastLoginAt=" + lastLoginAt
                + ", passwordHash=<redacted>, salt=<redacted>]";
    }

    public Builder toBuilder() {
        return new Builder(username)
                .displayName(displayName)
                .email(email)
                .passwordHash(passwordHash)
                .salt(salt)
                .role(role)
                .active(active)
                .failedAttempts(failedAttempts)
                .lockedUntil(lockedUntil)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastLoginAt(lastLoginAt);
    }

    public static Builder builder(String username) {
        return new Builder(username);
    }

    public static class Builder {
        private final String username;
        private String displayName;
        private String email;
        private String passwordHash;
        private String salt;
        private Role role = Role.USER;
        private boolean active = true;
        private int failedAttempts;
        private Instant lockedUntil;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastLoginAt;

        private Builder(String username) {
            this.username = username;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder passwordHash(String passwordHash) {
            this.passwordHash = passwordHash;
            return this;
        }

        public Builder salt(String salt) {
            this.salt = salt;
            return this;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder failedAttempts(int failedAttempts) {
            this.failedAttempts = failedAttempts;
            return this;
        }

        public Builder lockedUntil(Instant lockedUntil) {
            this.lockedUntil = lockedUntil;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder lastLoginAt(Instant lastLoginAt) {
            this.lastLoginAt = lastLoginAt;
            return this;
        }

        public UserRecord build() {
            return new UserRecord(
                    username,
                    displayName,
                    email,
                    passwordHash,
                    salt,
                    role,
                    active,
                    failedAttempts,
                    lockedUntil,
                    createdAt,
                    updatedAt,
                    lastLoginAt);
        }
    }
}
