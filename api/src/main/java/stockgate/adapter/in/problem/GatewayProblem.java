package stockgate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Every error response of the session endpoints is built here so that
 * titles and statuses stay consistent.
 */
public final class GatewayProblem {

    private GatewayProblem() {}

    public static HttpProblem userNotFound(String userId) {
        return HttpProblem.builder()
                .withTitle("User Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No active user '%s'".formatted(userId))
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem sessionsUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Sessions Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }
}
