package stockgate.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for session artifacts and the cookie that carries them.
 *
 * <p>Configuration prefix: {@code stockgate.session}
 */
@ConfigMapping(prefix = "stockgate.session")
public interface SessionConfig {

    /**
     * Minimum secret length, in characters, accepted for HS256 signing.
     */
    int MIN_SECRET_LENGTH = 32;

    /**
     * Shared HMAC secret used to sign and verify session artifacts.
     *
     * <p>Usually supplied through the {@code JWT_SECRET} environment variable.
     * A missing, blank or short secret is a configuration error: signing is
     * refused and every verification fails closed.
     *
     * @return the secret, if configured
     */
    Optional<String> secret();

    /**
     * Artifact time-to-live.
     *
     * @return TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration ttl();

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * Session cookie options.
     */
    interface CookieConfig {

        /**
         * @return cookie name (default: auth-token)
         */
        @WithDefault("auth-token")
        String name();

        /**
         * @return cookie path (default: /)
         */
        @WithDefault("/")
        String path();

        /**
         * Cookie domain. Defaults to the request host when unset.
         */
        Optional<String> domain();

        /**
         * Mark the cookie Secure. Disable only for plain-HTTP development.
         *
         * @return true if secure (default: true)
         */
        @WithDefault("true")
        boolean secure();

        /**
         * @return true if HttpOnly (default: true)
         */
        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute: Strict, Lax or None.
         *
         * @return SameSite value (default: Lax)
         */
        @WithDefault("Lax")
        String sameSite();
    }
}
