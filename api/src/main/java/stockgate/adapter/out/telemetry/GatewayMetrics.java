package stockgate.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import stockgate.config.TelemetryConfigMapping;
import stockgate.core.model.access.AccessDecision;
import stockgate.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, so callers never
 * check configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code stockgate.gateway.decisions} - decisions by outcome</li>
 *   <li>{@code stockgate.session.verification.failures} - rejected artifacts by reason</li>
 *   <li>{@code stockgate.session.minted} - minted artifacts by kind (issue, refresh)</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(AccessDecision decision) {
        if (!enabled) {
            return;
        }

        Counter.builder("stockgate.gateway.decisions")
                .description("Gateway decisions by outcome")
                .tag("outcome", decision.outcome())
                .register(registry)
                .increment();
    }

    @Override
    public void recordVerificationFailure(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("stockgate.session.verification.failures")
                .description("Session artifacts rejected during verification")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionMinted(String kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("stockgate.session.minted")
                .description("Session artifacts signed")
                .tag("kind", nullSafe(kind))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
