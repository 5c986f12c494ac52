package aqualog.spi;

/**
 * Thrown when the underlying credential storage cannot complete an operation
 * (connection failure, timeout, server error).
 *
 * <p>This engine reports the failure and does not retry; retry policy belongs
 * to the caller.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the name of the storage operation that failed. */
    public String getOperation() {
        return operation;
    }
}
