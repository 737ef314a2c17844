package stockgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import stockgate.spi.SecurityEvent;
import stockgate.spi.SecurityEventHandler;

/**
 * Security event handler that logs events on the {@code stockgate.security} category.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
@ApplicationScoped
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("stockgate.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        var message = formatEvent(event);

        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            return String.format(
                    "AUTH_FAILURE: client=%s reason=%s path=%s", e.clientIdentifier(), e.reason(), e.path());
        }
        if (event instanceof SecurityEvent.AccessDenied e) {
            return String.format(
                    "ACCESS_DENIED: client=%s user=%s role=%s path=%s",
                    e.clientIdentifier(), e.userId(), e.role(), e.path());
        }
        if (event instanceof SecurityEvent.SessionInvalidated e) {
            return String.format(
                    "SESSION_INVALIDATED: client=%s user=%s reason=%s", e.clientIdentifier(), e.userId(), e.reason());
        }
        return "SECURITY_EVENT: " + event;
    }
}
