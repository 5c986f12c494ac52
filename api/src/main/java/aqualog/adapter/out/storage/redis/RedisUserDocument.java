package aqualog.adapter.out.storage.redis;

import java.time.Instant;

import aqualog.core.model.auth.Role;
import aqualog.core.model.auth.UserRecord;

/**
 * JSON shape of a user record stored in Redis.
 *
 * <p>Kept separate from {@link UserRecord} so the stored format does not move
 * when the domain record changes.
 */
public record RedisUserDocument(
        String username,
        String displayName,
        String email,
        String passwordHash,
        String salt,
        String role,
        boolean active,
        int failedAttempts,
        Instant lockedUntil,
        Instant createdAt,
        Instant updatedAt,
        Instant lastLoginAt) {

    public static RedisUserDocument from(UserRecord record) {
        return new RedisUserDocument(
                record.username(),
                record.displayName(),
                record.email(),
                record.passwordHash(),
                record.salt(),
                record.role().value(),
                record.active(),
                record.failedAttempts(),
                record.lockedUntil(),
                record.createdAt(),
                record.updatedAt(),
                record.lastLoginAt());
    }

    public UserRecord toRecord() {
        return new UserRecord(
                username,
                displayName,
                email,
                passwordHash,
                salt,
                Role.fromValue(role),
                active,
                failedAttempts,
                lockedUntil,
                createdAt,
                updatedAt,
                lastLoginAt);
    }
}
