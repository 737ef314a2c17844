package stockgate.adapter.out.telemetry;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import stockgate.config.TelemetryConfigMapping;
import stockgate.core.port.out.SecurityMonitoring;
import stockgate.core.util.SecureHash;
import stockgate.spi.SecurityEvent;

/**
 * Turns gateway observations into {@link SecurityEvent}s.
 *
 * <p>Client addresses are hashed before they leave this class.
 */
@ApplicationScoped
public class SecurityMonitor implements SecurityMonitoring {

    private final SecurityEventDispatcher dispatcher;
    private final Clock clock;
    private final boolean enabled;

    @Inject
    public SecurityMonitor(TelemetryConfigMapping config, SecurityEventDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.enabled = config != null && config.enabled() && config.security().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthFailure(String clientIp, String reason, String path) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.AuthenticationFailure(
                clock.instant(), SecureHash.clientIdentifier(clientIp), reason, path));
    }

    @Override
    public void recordAccessDenied(String clientIp, String userId, String role, String path) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.AccessDenied(
                clock.instant(), SecureHash.clientIdentifier(clientIp), userId, role, path));
    }

    @Override
    public void recordSessionInvalidated(String clientIp, String userId, String reason) {
        if (!enabled) {
            return;
        }
        dispatcher.dispatch(new SecurityEvent.SessionInvalidated(
                clock.instant(), SecureHash.clientIdentifier(clientIp), userId, reason));
    }
}
