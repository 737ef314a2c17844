package stockgate.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for gateway metrics and security monitoring.
 *
 * <p>Both features are off by default and must be switched on explicitly:
 * <pre>{@code
 * stockgate.telemetry.enabled=true
 * stockgate.telemetry.metrics.enabled=true
 * stockgate.telemetry.security.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "stockgate.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle. When disabled every sub-feature is off regardless of its own setting.
     */
    @WithDefault("false")
    boolean enabled();

    MetricsConfig metrics();

    SecurityConfig security();

    interface MetricsConfig {
        /**
         * Record gateway decisions and session counters with Micrometer.
         */
        @WithDefault("false")
        boolean enabled();
    }

    interface SecurityConfig {
        /**
         * Dispatch security events to the registered handlers.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
