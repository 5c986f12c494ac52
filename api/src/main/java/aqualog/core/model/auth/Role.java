package aqualog.core.model.auth;

import java.util.Locale;

/**
 * Account role. Determines the capability set granted to a user.
 *
 * <p>Roles are granted wholesale: there are no per-operation allow-lists.
 * See {@link Capability} for what each role may do.
 */
public enum Role {

    /** Full access: read, write and user administration. */
    ADMIN("admin"),

    /** Read-only access. */
    USER("user");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /**
     * Returns the persisted string value of this role.
     *
     * @return role value (e.g., "admin")
     */
    public String value() {
        return value;
    }

    /**
     * Resolves a role from its persisted value, ignoring case.
     *
     * @param value the role value
     * @return the matching role
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be null or blank");
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
