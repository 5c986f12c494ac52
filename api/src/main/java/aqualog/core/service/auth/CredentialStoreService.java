package aqualog.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aqualog.core.config.CredentialPolicyConfig;
import aqualog.core.config.LockoutConfig;
import aqualog.core.model.auth.AuthenticationResult.Failure;
import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserRecord;
import aqualog.core.port.in.UserManagement.DuplicateUsernameException;
import aqualog.core.port.in.UserManagement.InvalidInputException;
import aqualog.core.port.in.UserManagement.UserNotFoundException;
import aqualog.core.port.out.CredentialRepository;
import aqualog.core.port.out.SecurityMonitoring;

/**
 * The credential store: user records with hashed, encrypted passwords and
 * lockout state.
 *
 * <p>Every mutation is a single {@link CredentialRepository#update} call, so
 * counters, timestamps and the encrypted hash of a record always change
 * together. Passwords are hashed with {@link PasswordHasher} and the hash is
 * encrypted with {@link PasswordHashCipher} before it reaches the repository.
 *
 * <p>A password change keeps the account's salt. Usernames are matched
 * exactly; creating a user whose name differs from an existing one only in
 * case is rejected as a duplicate.
 */
@ApplicationScoped
public class CredentialStoreService {

    private static final Logger LOG = Logger.getLogger(CredentialStoreService.class);

    private static final int DISPLAY_NAME_MAX_LENGTH = 128;
    private static final int EMAIL_MAX_LENGTH = 254;

    private final CredentialRepository repository;
    private final PasswordHasher hasher;
    private final PasswordHashCipher cipher;
    private final LockoutConfig lockoutConfig;
    private final CredentialPolicyConfig policyConfig;
    private final SecurityMonitoring securityMonitoring;
    private final Clock clock;

    @Inject
    public CredentialStoreService(
            CredentialRepository repository,
            PasswordHasher hasher,
            PasswordHashCipher cipher,
            LockoutConfig lockoutConfig,
            CredentialPolicyConfig policyConfig,
            SecurityMonitoring securityMonitoring,
            Clock clock) {
        this.repository = repository;
        this.hasher = hasher;
        this.cipher = cipher;
        this.lockoutConfig = lockoutConfig;
        this.policyConfig = policyConfig;
        this.securityMonitoring = securityMonitoring;
        this.clock = clock;
    }

    /**
     * Create a user with a fresh salt.
     *
     * @return the stored record
     */
    public Uni<UserRecord> create(String username, String password, Role role, String displayName, String email) {
        return Uni.createFrom()
                .item(() -> {
                    validateUsername(username);
                    validatePassword(password);
                    if (role == null) {
                        throw new InvalidInputException("Role is required");
                    }
                    validateOptional("Display name", displayName, DISPLAY_NAME_MAX_LENGTH);
                    validateEmail(email);

                    final String salt = hasher.generateSalt();
                    final Instant now = clock.instant();
                    return UserRecord.builder(username)
                            .displayName(displayName)
                            .email(email)
                            .salt(salt)
                            .passwordHash(cipher.encrypt(hasher.hash(password, salt)))
                            .role(role)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                })
                .flatMap(record -> repository.insertIfAbsent(record).map(inserted -> {
                    if (!inserted) {
                        throw new DuplicateUsernameException(username);
                    }
                    LOG.infof("User created: %s (role=%s)", username, role.value());
                    return record;
                }));
    }

    /**
     * Look up a user by exact, case-sensitive username.
     */
    public Uni<Optional<UserRecord>> find(String username) {
        if (username == null || username.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findByUsername(username);
    }

    public Uni<UserRecord> updateRole(String username, Role role) {
        if (role == null) {
            return Uni.createFrom().failure(new InvalidInputException("Role is required"));
        }
        return mutate(username, record -> record.withRole(role, clock.instant()));
    }

    /**
     * Re-hash a user's password with the existing salt and re-encrypt it. Also
     * clears the failure counter and any lockout.
     */
    public Uni<UserRecord> setPassword(String username, String newPassword) {
        try {
            validatePassword(newPassword);
        } catch (InvalidInputException e) {
            return Uni.createFrom().failure(e);
        }

        return requireExisting(username).flatMap(existing -> {
            final String salt = existing.salt();
            final String encryptedHash = cipher.encrypt(hasher.hash(newPassword, salt));
            return mutate(username, record -> {
                if (!record.salt().equals(salt)) {
                    throw new IllegalStateException("User record was replaced concurrently: " + username);
                }
                return record.withPasswordHash(encryptedHash, clock.instant());
            });
        });
    }

    public Uni<UserRecord> setActive(String username, boolean active) {
        return mutate(username, record -> record.withActive(active, clock.instant()));
    }

    /**
     * Count a failed login. When the counter reaches the configured threshold
     * the account is locked for the configured duration.
     *
     * @return the new failure count
     */
    public Uni<Integer> recordFailedAttempt(String username) {
        final int threshold = lockoutConfig.maxFailedAttempts();
        return mutate(username, record -> {
                    final Instant now = clock.instant();
                    final int count = record.failedAttempts() + 1;
                    final Instant lockedUntil =
                            count >= threshold ? now.plus(lockoutConfig.duration()) : record.lockedUntil();
                    return record.withFailedAttempts(count, lockedUntil, now);
                })
                .invoke(updated -> {
                    if (updated.failedAttempts() >= threshold) {
                        LOG.warnf(
                                "Account locked: %s after %d failed attempts, until %s",
                                username, updated.failedAttempts(), updated.lockedUntil());
                        securityMonitoring.recordLockout(username, updated.failedAttempts(), updated.lockedUntil());
                    }
                })
                .map(UserRecord::failedAttempts);
    }

    /**
     * Reset the failure counter, clear any lockout and stamp the login time.
     *
     * <p>The account state is checked again against the record being replaced,
     * so a deactivation or lockout that lands after the password check still
     * refuses the login.
     *
     * @throws LoginRefusedException (in the returned Uni) if the account is
     *                               deactivated or locked at write time
     */
    public Uni<Void> recordSuccess(String username) {
        return mutate(username, record -> {
                    final Instant now = clock.instant();
                    if (!record.active()) {
                        throw new LoginRefusedException(Failure.disabled(), record.failedAttempts());
                    }
                    if (record.isLocked(now)) {
                        throw new LoginRefusedException(
                                Failure.locked(record.remainingLockout(now)), record.failedAttempts());
                    }
                    return record.withSuccessfulLogin(now);
                })
                .replaceWithVoid();
    }

    /**
     * Clear the lockout and failure counter unconditionally.
     */
    public Uni<UserRecord> unlock(String username) {
        return mutate(username, record -> record.withUnlocked(clock.instant()));
    }

    /**
     * All users, sorted by username.
     */
    public Uni<List<UserRecord>> listAll() {
        return repository.findAll().map(records -> records.stream()
                .sorted(Comparator.comparing(UserRecord::username))
                .toList());
    }

    public Uni<Void> delete(String username) {
        return repository
                .delete(username)
                .invoke(deleted -> {
                    if (!deleted) {
                        throw new UserNotFoundException(username);
                    }
                    LOG.infof("User deleted: %s", username);
                })
                .replaceWithVoid();
    }

    public Uni<Long> count() {
        return repository.count();
    }

    /**
     * Check a submitted password against a stored record.
     *
     * @param record   the stored record
     * @param password the submitted password
     * @return true if the password matches
     */
    public boolean verifyPassword(UserRecord record, String password) {
        final String storedHash = cipher.decrypt(record.passwordHash());
        return hasher.verify(password, record.salt(), storedHash);
    }

    /**
     * Burn the cost of one verification without a record to check against.
     */
    public void dummyVerify(String password) {
        hasher.dummyVerify(password);
    }

    private Uni<UserRecord> requireExisting(String username) {
        return find(username).map(existing -> existing.orElseThrow(() -> new UserNotFoundException(username)));
    }

    private Uni<UserRecord> mutate(String username, UnaryOperator<UserRecord> mutation) {
        if (username == null || username.isBlank()) {
            return Uni.createFrom().failure(new UserNotFoundException(String.valueOf(username)));
        }
        return repository
                .update(username, mutation)
                .map(updated -> updated.orElseThrow(() -> new UserNotFoundException(username)));
    }

    private void validateUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new InvalidInputException("Username cannot be blank");
        }
        if (username.length() > policyConfig.usernameMaxLength()) {
            throw new InvalidInputException(
                    "Username cannot exceed " + policyConfig.usernameMaxLength() + " characters");
        }
        for (int i = 0; i < username.length(); i++) {
            final char c = username.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidInputException("Username cannot contain whitespace or control characters");
            }
        }
    }

    private void validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidInputException("Password cannot be empty");
        }
        if (password.length() < policyConfig.passwordMinLength()) {
            throw new InvalidInputException(
                    "Password must be at least " + policyConfig.passwordMinLength() + " characters");
        }
        if (password.length() > policyConfig.passwordMaxLength()) {
            throw new InvalidInputException(
                    "Password cannot exceed " + policyConfig.passwordMaxLength() + " characters");
        }
    }

    private void validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return;
        }
        validateOptional("Email", email, EMAIL_MAX_LENGTH);
        final int at = email.indexOf('@');
        if (at <= 0 || at != email.lastIndexOf('@') || at == email.length() - 1) {
            throw new InvalidInputException("Email address is not valid");
        }
    }

    private void validateOptional(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidInputException(field + " cannot exceed " + maxLength + " characters");
        }
    }

    /**
     * A successful login could not be recorded because the account was
     * deactivated or locked in the meantime.
     */
    public static class LoginRefusedException extends RuntimeException {
        private final transient Failure failure;
        private final int failedAttempts;

        public LoginRefusedException(Failure failure, int failedAttempts) {
            super("Login refused: " + failure.error().code());
            this.failure = failure;
            this.failedAttempts = failedAttempts;
        }

        public Failure failure() {
            return failure;
        }

        public int failedAttempts() {
            return failedAttempts;
        }
    }
}
