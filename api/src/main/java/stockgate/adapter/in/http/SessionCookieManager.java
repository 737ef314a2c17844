package stockgate.adapter.in.http;

import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.CookieSameSite;
import io.vertx.core.http.HttpServerRequest;

import stockgate.core.config.SessionConfig;
import stockgate.core.model.session.SessionArtifact;

/**
 * Manages the session cookie: creation, extraction and deletion.
 *
 * <p>The gateway filter works with Vert.x cookies, the REST endpoints with
 * JAX-RS ones; both are built from the same configuration.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final SessionConfig config;

    @Inject
    public SessionCookieManager(SessionConfig config) {
        this.config = config;
    }

    /**
     * Deletion cookie for the gateway's redirect responses.
     */
    public Cookie createDeletionCookie() {
        Cookie cookie = Cookie.cookie(cookieName(), "")
                .setPath(config.cookie().path())
                .setSecure(config.cookie().secure())
                .setHttpOnly(config.cookie().httpOnly())
                .setSameSite(parseSameSite(config.cookie().sameSite()))
                .setMaxAge(0);
        config.cookie().domain().ifPresent(cookie::setDomain);
        return cookie;
    }

    /**
     * Cookie carrying a freshly minted artifact, for REST responses.
     */
    public NewCookie createCookie(SessionArtifact artifact) {
        return builder(artifact.token())
                .maxAge((int) config.ttl().toSeconds())
                .build();
    }

    /**
     * Cookie that deletes the session, for REST responses.
     */
    public NewCookie createLogoutCookie() {
        return builder("").maxAge(0).build();
    }

    /**
     * Extracts the session artifact from the request cookies.
     *
     * @param request the HTTP request
     * @return the artifact, or empty if absent or blank
     */
    public Optional<String> extractToken(HttpServerRequest request) {
        Cookie cookie = request.getCookie(cookieName());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public String cookieName() {
        return config.cookie().name();
    }

    private NewCookie.Builder builder(String value) {
        NewCookie.Builder builder = new NewCookie.Builder(cookieName())
                .value(value)
                .path(config.cookie().path())
                .secure(config.cookie().secure())
                .httpOnly(config.cookie().httpOnly())
                .sameSite(parseJaxRsSameSite(config.cookie().sameSite()));
        config.cookie().domain().ifPresent(builder::domain);
        return builder;
    }

    private CookieSameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> CookieSameSite.STRICT;
            case "NONE" -> CookieSameSite.NONE;
            default -> CookieSameSite.LAX;
        };
    }

    private NewCookie.SameSite parseJaxRsSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
