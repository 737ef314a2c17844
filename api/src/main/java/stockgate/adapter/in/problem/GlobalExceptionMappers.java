package stockgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import stockgate.core.service.session.SessionConfigurationException;
import stockgate.core.service.session.SnapshotNotFoundException;

/**
 * Converts domain exceptions to RFC 7807 Problem Details.
 *
 * <p>None of these responses touch the session cookie.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapSnapshotNotFound(SnapshotNotFoundException e) {
        LOG.infov("Session not minted for user {0}: {1}", e.userId(), e.reason());
        return toResponse(GatewayProblem.userNotFound(e.userId()));
    }

    @ServerExceptionMapper
    public Response mapSessionConfigurationException(SessionConfigurationException e) {
        LOG.errorv("Session signing unavailable: {0}", e.getMessage());
        return toResponse(GatewayProblem.sessionsUnavailable("Session signing is not configured"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(GatewayProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
