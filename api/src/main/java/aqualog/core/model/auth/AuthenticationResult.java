package aqualog.core.model.auth;

import java.time.Duration;

import aqualog.core.model.session.Session;

/**
 * Represents the result of a login attempt.
 *
 * This is a sealed interface with two possible outcomes:
 * - Success: the credentials were accepted and a session was opened
 * - Failure: the login was refused for the given {@link AuthError}
 */
public sealed interface AuthenticationResult {

    /**
     * Check whether the login succeeded.
     *
     * @return true for {@link Success}
     */
    boolean isSuccess();

    /**
     * Login succeeded.
     *
     * @param identity the authenticated principal
     * @param session  the session opened for this login
     */
    record Success(Identity identity, Session session) implements AuthenticationResult {
        public Success {
            if (identity == null) {
                throw new IllegalArgumentException("Identity cannot be null");
            }
            if (session == null) {
                throw new IllegalArgumentException("Session cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Login refused.
     *
     * <p>{@link #retryAfter()} is only meaningful for {@link AuthError#ACCOUNT_LOCKED}
     * and is intended for privileged callers. It is deliberately not part of
     * {@link #userMessage()}.
     *
     * @param error      refusal reason
     * @param retryAfter remaining lockout, or {@link Duration#ZERO}
     */
    record Failure(AuthError error, Duration retryAfter) implements AuthenticationResult {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("AuthError cannot be null");
            }
            if (retryAfter == null || retryAfter.isNegative()) {
                retryAfter = Duration.ZERO;
            }
        }

        public static Failure invalidCredentials() {
            return new Failure(AuthError.INVALID_CREDENTIALS, Duration.ZERO);
        }

        public static Failure disabled() {
            return new Failure(AuthError.ACCOUNT_DISABLED, Duration.ZERO);
        }

        public static Failure locked(Duration remaining) {
            return new Failure(AuthError.ACCOUNT_LOCKED, remaining);
        }

        /**
         * Generic message for the end user.
         */
        public String userMessage() {
            return error.userMessage();
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
