package stockgate.adapter.in.http;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import io.vertx.core.MultiMap;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import stockgate.core.model.access.AccessDecision;
import stockgate.core.model.access.IdentityAnnotation;
import stockgate.core.model.access.IdentityHeaders;
import stockgate.core.port.in.AccessGateway;
import stockgate.core.port.out.Metrics;
import stockgate.core.port.out.SecurityMonitoring;
import stockgate.support.TestSessionConfig;

@DisplayName("SessionGatewayFilter")
class SessionGatewayFilterTest {

    private AccessGateway gateway;
    private Metrics metrics;
    private SecurityMonitoring securityMonitoring;
    private SessionGatewayFilter filter;

    private RoutingContext rc;
    private HttpServerRequest request;
    private HttpServerResponse response;
    private MultiMap headers;

    @BeforeEach
    void setUp() {
        gateway = mock(AccessGateway.class);
        metrics = mock(Metrics.class);
        securityMonitoring = mock(SecurityMonitoring.class);
        filter = new SessionGatewayFilter(
                gateway, new SessionCookieManager(new TestSessionConfig()), metrics, securityMonitoring);

        rc = mock(RoutingContext.class);
        request = mock(HttpServerRequest.class);
        response = mock(HttpServerResponse.class, RETURNS_SELF);
        headers = MultiMap.caseInsensitiveMultiMap();

        when(rc.request()).thenReturn(request);
        when(rc.response()).thenReturn(response);
        when(rc.normalizedPath()).thenReturn("/dashboard");
        when(request.headers()).thenReturn(headers);
        when(request.method()).thenReturn(HttpMethod.GET);
    }

    private void presentCookie(String value) {
        when(request.getCookie("auth-token")).thenReturn(Cookie.cookie("auth-token", value));
    }

    @Nested
    @DisplayName("Allow")
    class Allow {

        @Test
        @DisplayName("should strip client-supplied identity headers")
        void shouldStripSpoofedHeaders() {
            headers.add(IdentityHeaders.USER_ID, "attacker");
            headers.add(IdentityHeaders.USER_ROLE, "ADMIN");
            headers.add("X-Organization-Id", "org-evil");
            when(gateway.evaluate("/dashboard", Optional.empty())).thenReturn(AccessDecision.Allow.anonymous());

            filter.filter(rc);

            assertFalse(headers.contains(IdentityHeaders.USER_ID));
            assertFalse(headers.contains(IdentityHeaders.USER_ROLE));
            assertFalse(headers.contains(IdentityHeaders.ORGANIZATION_ID));
            verify(rc).next();
        }

        @Test
        @DisplayName("should inject verified identity and continue")
        void shouldInjectIdentity() {
            presentCookie("token");
            headers.add(IdentityHeaders.USER_ID, "attacker");
            var identity = new IdentityAnnotation("u-1", "a@example.com", "ADMIN", "org-1", null);
            when(gateway.evaluate("/dashboard", Optional.of("token")))
                    .thenReturn(AccessDecision.Allow.authenticated(identity));

            filter.filter(rc);

            assertEquals("u-1", headers.get(IdentityHeaders.USER_ID));
            assertEquals("org-1", headers.get(IdentityHeaders.ORGANIZATION_ID));
            assertNull(headers.get(IdentityHeaders.STORE_ID));
            verify(rc).put(SessionGatewayFilter.IDENTITY_KEY, identity);
            verify(rc).next();
            verify(metrics).recordDecision(AccessDecision.Allow.authenticated(identity));
        }
    }

    @Nested
    @DisplayName("Redirects")
    class Redirects {

        @Test
        @DisplayName("should answer 307 to login without touching the cookie when none was sent")
        void shouldRedirectWithoutDeletion() {
            when(gateway.evaluate("/dashboard", Optional.empty()))
                    .thenReturn(new AccessDecision.RedirectToLogin(
                            "/auth/login?redirect=%2Fdashboard",
                            "/dashboard",
                            false,
                            AccessDecision.RedirectToLogin.NO_SESSION));

            filter.filter(rc);

            verify(response).setStatusCode(307);
            verify(response).putHeader(HttpHeaders.LOCATION, (CharSequence) "/auth/login?redirect=%2Fdashboard");
            verify(response, never()).addCookie(any());
            verify(response).end();
            verify(rc, never()).next();
            verify(securityMonitoring, never()).recordAuthFailure(any(), anyString(), anyString());
        }

        @Test
        @DisplayName("should delete the cookie and report a rejected artifact")
        void shouldDeleteRejectedArtifact() {
            presentCookie("stale");
            when(gateway.evaluate("/dashboard", Optional.of("stale")))
                    .thenReturn(new AccessDecision.RedirectToLogin(
                            "/auth/login?redirect=%2Fdashboard", "/dashboard", true, "expired"));

            filter.filter(rc);

            var cookie = ArgumentCaptor.forClass(Cookie.class);
            verify(response).addCookie(cookie.capture());
            assertEquals("auth-token", cookie.getValue().getName());
            assertEquals("", cookie.getValue().getValue());
            assertThat(cookie.getValue().encode(), containsString("Max-Age=0"));

            verify(metrics).recordVerificationFailure("expired");
            verify(securityMonitoring).recordAuthFailure(null, "expired", "/dashboard");
            verify(securityMonitoring).recordSessionInvalidated(null, null, "expired");
        }

        @Test
        @DisplayName("should report policy denials and keep the cookie")
        void shouldReportDenial() {
            presentCookie("token");
            when(request.getHeader("X-Forwarded-For")).thenReturn("203.0.113.5");
            when(rc.normalizedPath()).thenReturn("/dashboard/products");
            when(gateway.evaluate("/dashboard/products", Optional.of("token")))
                    .thenReturn(new AccessDecision.RedirectToUnauthorized(
                            "/dashboard", "/dashboard/products", "u-2", "SELLER"));

            filter.filter(rc);

            verify(response).putHeader(HttpHeaders.LOCATION, (CharSequence) "/dashboard");
            verify(response, never()).addCookie(any());
            verify(securityMonitoring).recordAccessDenied("203.0.113.5", "u-2", "SELLER", "/dashboard/products");
        }

        @Test
        @DisplayName("should not count a landing-page lockout as a verification failure")
        void shouldSeparateLandingLockout() {
            presentCookie("token");
            when(gateway.evaluate(eq("/dashboard"), any()))
                    .thenReturn(new AccessDecision.RedirectToLogin(
                            "/auth/login?redirect=%2Fdashboard",
                            "/dashboard",
                            true,
                            AccessDecision.RedirectToLogin.NO_ACCESSIBLE_LANDING));

            filter.filter(rc);

            verify(response).addCookie(any());
            verify(metrics, never()).recordVerificationFailure(anyString());
            verify(securityMonitoring)
                    .recordSessionInvalidated(null, null, AccessDecision.RedirectToLogin.NO_ACCESSIBLE_LANDING);
        }
    }
}
