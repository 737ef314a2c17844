package stockgate.spi;

/**
 * SPI for reacting to security events raised by the gateway.
 *
 * <p>Implementations are either CDI beans or plug-ins discovered via
 * {@link java.util.ServiceLoader} from
 * {@code META-INF/services/stockgate.spi.SecurityEventHandler}; plug-ins need
 * a public no-argument constructor.
 *
 * <p>Built-in handlers (CDI beans):
 * <ul>
 *   <li>{@code logging} - logs events on the {@code stockgate.security} category (priority 0)</li>
 *   <li>{@code metrics} - counts events with Micrometer (priority 10)</li>
 * </ul>
 */
public interface SecurityEventHandler {

    /**
     * Unique name of this handler.
     */
    String name();

    default String description() {
        return name() + " security event handler";
    }

    /**
     * Higher priority handlers are invoked first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether the handler should receive events.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event.
     *
     * <p>Implementations should catch their own failures; an exception thrown
     * here is logged by the dispatcher and does not reach other handlers.
     *
     * @param event the event
     */
    void handle(SecurityEvent event);

    /**
     * Release resources on shutdown.
     */
    default void close() {}
}
