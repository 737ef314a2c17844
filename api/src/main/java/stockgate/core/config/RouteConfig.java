package stockgate.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Route tables consulted by the gateway.
 *
 * <p>Loaded once at startup; the gateway never mutates them.
 *
 * <p>Configuration prefix: {@code stockgate.routes}
 */
@ConfigMapping(prefix = "stockgate.routes")
public interface RouteConfig {

    /**
     * Routes reachable without a session. Matched exactly or as a path prefix.
     */
    @WithDefault("/auth/login,/auth/register,/auth/forgot-password,/auth/reset-password,"
            + "/api/auth/login,/api/auth/register,/api/auth/forgot-password,/api/auth/reset-password")
    List<String> publicRoutes();

    /**
     * API routes that need a session but are not page navigations.
     */
    @WithDefault("/api/auth/logout,/api/auth/session,/api/auth/refresh")
    List<String> protectedApiRoutes();

    /**
     * Root of the dashboard subtree.
     */
    @WithDefault("/dashboard")
    String dashboardPath();

    /**
     * Root of the onboarding subtree.
     */
    @WithDefault("/onboarding")
    String onboardingPath();

    /**
     * Login page that unauthenticated requests are sent to.
     */
    @WithDefault("/auth/login")
    String loginPath();

    /**
     * Query parameter on the login redirect carrying the original path.
     */
    @WithDefault("redirect")
    String returnParameter();

    /**
     * Landing path for authenticated users refused by role policy.
     */
    @WithDefault("/dashboard")
    String unauthorizedPath();

    /**
     * Static asset exclusions.
     */
    StaticAssetConfig staticAssets();

    /**
     * Paths the gateway never evaluates.
     */
    interface StaticAssetConfig {

        /**
         * Path prefixes of build output, images and fonts.
         */
        @WithDefault("/static,/assets,/images,/fonts,/favicon.ico")
        List<String> prefixes();

        /**
         * File extensions (without the dot) served as static files.
         */
        @WithDefault("svg,png,jpg,jpeg,gif,webp,ico,css,js,woff,woff2,ttf,map")
        List<String> extensions();
    }
}
