package aqualog.spi;

/**
 * SPI for handling security events raised by the credential engine.
 *
 * <p>Implementations are CDI beans. Handlers packaged outside the application
 * can instead be registered for {@link java.util.ServiceLoader} in
 * {@code META-INF/services/aqualog.spi.SecurityEventHandler}; such a handler
 * is ignored if a bean already uses its name.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer metrics (priority 10)</li>
 * </ul>
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "logging", "metrics")
     */
    String name();

    /**
     * Returns a human-readable description of this handler.
     *
     * @return handler description
     */
    default String description() {
        return name() + " security event handler";
    }

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value (higher = invoked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler is currently available.
     *
     * @return true if handler is available and should receive events
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Implementations should catch and log any exceptions rather
     * than propagating them, as this would prevent other handlers
     * from processing the event.
     *
     * @param event the security event to handle
     */
    void handle(SecurityEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
