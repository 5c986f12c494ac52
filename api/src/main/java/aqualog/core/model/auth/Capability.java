package aqualog.core.model.auth;

/**
 * Named permissions granted per role.
 *
 * <p>{@link Role#ADMIN} holds all three; {@link Role#USER} holds {@link #READ} only.
 */
public enum Capability {

    /** View data. */
    READ,

    /** Modify data. */
    WRITE,

    /** Manage user accounts. */
    ADMIN
}
