package stockgate.adapter.in.http;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import stockgate.adapter.in.problem.GatewayProblem;
import stockgate.core.model.access.IdentityAnnotation;
import stockgate.core.model.session.RequestMetadata;
import stockgate.core.port.in.SessionManagement;
import stockgate.core.port.out.SecurityMonitoring;
import stockgate.core.service.access.RolePolicyTable;

/**
 * Session endpoints.
 *
 * <p>All three routes are protected by the gateway filter, which has already
 * verified the session and injected the identity headers by the time a
 * method here runs.
 */
@Path("/api/auth")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    @Inject
    SessionManagement sessionManagement;

    @Inject
    SessionCookieManager cookieManager;

    @Inject
    RolePolicyTable policy;

    @Inject
    SecurityMonitoring securityMonitoring;

    @Context
    HttpServerRequest request;

    /**
     * Current identity plus the capabilities its role holds.
     */
    @GET
    @Path("/session")
    public SessionView session(@Context HttpHeaders headers) {
        IdentityAnnotation identity = requireIdentity(headers);
        List<String> capabilities = policy.capabilities(identity.role()).stream()
                .map(Enum::name)
                .sorted()
                .toList();
        return new SessionView(
                identity.userId(),
                identity.email(),
                identity.role(),
                identity.organizationId(),
                identity.storeId(),
                identity.organizationId() != null,
                capabilities);
    }

    /**
     * Re-mint the session from the user store, after the user's organization,
     * store or role changed.
     */
    @POST
    @Path("/refresh")
    public Uni<Response> refresh(@Context HttpHeaders headers) {
        IdentityAnnotation identity = requireIdentity(headers);
        return sessionManagement
                .refreshSession(identity.userId(), metadata())
                .map(artifact -> Response.ok(new RefreshView(artifact.userId(), artifact.expiresAt()))
                        .cookie(cookieManager.createCookie(artifact))
                        .build());
    }

    /**
     * Clear the session cookie.
     */
    @POST
    @Path("/logout")
    public Response logout(@Context HttpHeaders headers) {
        String userId = IdentityAnnotation.fromHeaders(headers::getHeaderString)
                .map(IdentityAnnotation::userId)
                .orElse(null);
        securityMonitoring.recordSessionInvalidated(SessionGatewayFilter.clientIp(request), userId, "logout");
        LOG.infof("User %s logged out", userId);
        return Response.ok(Map.of("message", "Logged out"))
                .cookie(cookieManager.createLogoutCookie())
                .build();
    }

    private IdentityAnnotation requireIdentity(HttpHeaders headers) {
        return IdentityAnnotation.fromHeaders(headers::getHeaderString)
                .orElseThrow(() -> GatewayProblem.unauthorized("Not authenticated"));
    }

    private RequestMetadata metadata() {
        return new RequestMetadata(SessionGatewayFilter.clientIp(request), request.getHeader("User-Agent"));
    }

    /**
     * Response body of {@code GET /api/auth/session}.
     */
    public record SessionView(
            String userId,
            String email,
            String role,
            String organizationId,
            String storeId,
            boolean onboardingComplete,
            List<String> capabilities) {}

    /**
     * Response body of {@code POST /api/auth/refresh}.
     */
    public record RefreshView(String userId, Instant expiresAt) {}
}
