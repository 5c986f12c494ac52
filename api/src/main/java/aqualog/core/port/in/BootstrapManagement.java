package aqualog.core.port.in;

import io.smallrye.mutiny.Uni;

import aqualog.core.model.auth.UserSummary;

/**
 * Port for first-administrator bootstrap.
 *
 * <p>Creates the initial administrator account when the credential store is
 * empty. The password must be provided by the operator via configuration; it
 * is never auto-generated.
 */
public interface BootstrapManagement {

    /**
     * Create the bootstrap administrator using the configured credentials.
     *
     * @return Uni with the created account
     * @throws BootstrapException if bootstrap is misconfigured or fails
     */
    Uni<UserSummary> bootstrap();

    /**
     * Check if bootstrap should run: bootstrap is enabled and the store is empty.
     *
     * @return Uni with true if bootstrap should be attempted
     */
    Uni<Boolean> shouldBootstrap();

    /**
     * Exception thrown when bootstrap fails due to misconfiguration or error.
     */
    class BootstrapException extends RuntimeException {
        public BootstrapException(String message) {
            super(message);
        }

        public BootstrapException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
