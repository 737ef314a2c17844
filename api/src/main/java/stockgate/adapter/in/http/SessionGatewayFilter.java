package stockgate.adapter.in.http;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import stockgate.core.model.access.AccessDecision;
import stockgate.core.model.access.IdentityAnnotation;
import stockgate.core.model.access.IdentityHeaders;
import stockgate.core.port.in.AccessGateway;
import stockgate.core.port.out.Metrics;
import stockgate.core.port.out.SecurityMonitoring;
import stockgate.core.service.common.ClientIpExtractor;

/**
 * Applies the access decision to every incoming request.
 *
 * <p>Runs at the Vert.x routing level, before JAX-RS, so that pages and API
 * endpoints alike are covered. Client-supplied identity headers are removed
 * before evaluation; on {@code Allow} the verified identity is written back
 * as request headers and stored on the routing context. Every other decision
 * ends the exchange with {@code 307 Temporary Redirect}.
 */
@ApplicationScoped
public class SessionGatewayFilter {

    private static final Logger LOG = Logger.getLogger(SessionGatewayFilter.class);

    /**
     * Routing-context key under which the verified {@link IdentityAnnotation} is stored.
     */
    public static final String IDENTITY_KEY = "stockgate.identity";

    private final AccessGateway gateway;
    private final SessionCookieManager cookieManager;
    private final Metrics metrics;
    private final SecurityMonitoring securityMonitoring;

    @Inject
    public SessionGatewayFilter(
            AccessGateway gateway,
            SessionCookieManager cookieManager,
            Metrics metrics,
            SecurityMonitoring securityMonitoring) {
        this.gateway = gateway;
        this.cookieManager = cookieManager;
        this.metrics = metrics;
        this.securityMonitoring = securityMonitoring;
    }

    @RouteFilter(80)
    void filter(RoutingContext rc) {
        HttpServerRequest request = rc.request();
        for (String header : IdentityHeaders.ALL) {
            request.headers().remove(header);
        }

        String path = rc.normalizedPath();
        Optional<String> artifact = cookieManager.extractToken(request);
        AccessDecision decision = gateway.evaluate(path, artifact);
        metrics.recordDecision(decision);

        if (decision instanceof AccessDecision.Allow allow) {
            allow.identity().ifPresent(identity -> annotate(rc, identity));
            rc.next();
            return;
        }

        AccessDecision.Redirect redirect = (AccessDecision.Redirect) decision;
        report(rc, path, redirect);

        LOG.debugf("%s %s -> %s (%s)", request.method(), path, redirect.location(), decision.outcome());
        var response = rc.response()
                .setStatusCode(307)
                .putHeader(HttpHeaders.LOCATION, redirect.location());
        if (redirect.clearArtifact()) {
            response.addCookie(cookieManager.createDeletionCookie());
        }
        response.end();
    }

    private void annotate(RoutingContext rc, IdentityAnnotation identity) {
        identity.toHeaders().forEach((name, value) -> rc.request().headers().set(name, value));
        rc.put(IDENTITY_KEY, identity);
    }

    private void report(RoutingContext rc, String path, AccessDecision.Redirect redirect) {
        if (redirect instanceof AccessDecision.RedirectToLogin login && login.clearArtifact()) {
            String clientIp = clientIp(rc.request());
            if (login.isVerificationFailure()) {
                metrics.recordVerificationFailure(login.reason());
                securityMonitoring.recordAuthFailure(clientIp, login.reason(), path);
            }
            securityMonitoring.recordSessionInvalidated(clientIp, null, login.reason());
        } else if (redirect instanceof AccessDecision.RedirectToUnauthorized denied) {
            securityMonitoring.recordAccessDenied(
                    clientIp(rc.request()), denied.userId(), denied.role(), denied.deniedPath());
        }
    }

    static String clientIp(HttpServerRequest request) {
        String remote = request.remoteAddress() != null ? request.remoteAddress().host() : null;
        return ClientIpExtractor.extract(request::getHeader, remote);
    }
}
