package stockgate.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import stockgate.spi.SecurityEvent;
import stockgate.spi.SecurityEventHandler;

/**
 * Security event handler that counts events with Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code stockgate.security.events.total} - all events by type and severity</li>
 *   <li>{@code stockgate.security.auth.failures} - rejected artifacts by reason</li>
 *   <li>{@code stockgate.security.access.denied} - policy denials by role</li>
 *   <li>{@code stockgate.security.session.invalidated} - cleared sessions by reason</li>
 * </ul>
 */
@ApplicationScoped
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private final MeterRegistry registry;

    @Inject
    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records security events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void handle(SecurityEvent event) {
        Counter.builder("stockgate.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.AuthenticationFailure e) {
            count("stockgate.security.auth.failures", "Rejected session artifacts", "reason", e.reason());
        } else if (event instanceof SecurityEvent.AccessDenied e) {
            count("stockgate.security.access.denied", "Role policy denials", "role", e.role());
        } else if (event instanceof SecurityEvent.SessionInvalidated e) {
            count("stockgate.security.session.invalidated", "Session invalidations", "reason", e.reason());
        }
    }

    private void count(String name, String description, String tagKey, String tagValue) {
        Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue == null || tagValue.isBlank() ? "unknown" : tagValue)
                .register(registry)
                .increment();
    }
}
