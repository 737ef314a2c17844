package stockgate.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * User snapshots loaded into the in-memory user store at startup.
 *
 * <p>Intended for development and tests; production deployments plug a real
 * store behind {@link stockgate.core.port.out.UserSnapshotRepository}.
 *
 * <pre>{@code
 * stockgate.users.seed.u-admin.email=admin@example.com
 * stockgate.users.seed.u-admin.role=ADMIN
 * stockgate.users.seed.u-admin.organization-id=org-1
 * }</pre>
 */
@ConfigMapping(prefix = "stockgate.users")
public interface UserSeedConfigMapping {

    /**
     * Seed users keyed by user ID.
     */
    Map<String, SeedUser> seed();

    interface SeedUser {

        String email();

        @WithDefault("SELLER")
        String role();

        Optional<String> organizationId();

        Optional<String> storeId();

        @WithDefault("true")
        boolean active();

        @WithDefault("false")
        boolean deleted();
    }
}
