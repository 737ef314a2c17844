package stockgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.specification.RequestSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import stockgate.core.model.session.SessionSubject;
import stockgate.core.port.in.SessionManagement;
import stockgate.core.service.session.SessionTokenCodec;

/**
 * End-to-end behavior of the gateway filter against the seeded test users.
 */
@QuarkusTest
@DisplayName("Session gateway")
class SessionGatewayIntegrationTest {

    @Inject
    SessionManagement sessionManagement;

    @Inject
    SessionTokenCodec codec;

    private String sessionFor(String userId) {
        return sessionManagement.issueSession(userId, null).await().indefinitely().token();
    }

    private RequestSpecification request() {
        return given().redirects().follow(false);
    }

    @Nested
    @DisplayName("Without a session")
    class Anonymous {

        @Test
        @DisplayName("should send dashboard requests to login with the return path")
        void shouldRedirectToLogin() {
            request()
                    .when()
                    .get("/dashboard")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fdashboard")
                    .header("Set-Cookie", nullValue());
        }

        @Test
        @DisplayName("should not let segment parameters skip the session check")
        void shouldRedirectParameterizedDashboard() {
            request()
                    .urlEncodingEnabled(false)
                    .when()
                    .get("/dashboard;x=1")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fdashboard");
        }

        @Test
        @DisplayName("should not exempt asset-looking dashboard paths")
        void shouldRedirectDashboardAssetPath() {
            request()
                    .when()
                    .get("/dashboard/products.js")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fdashboard%2Fproducts.js");
        }

        @Test
        @DisplayName("should serve public pages")
        void shouldServePublicPages() {
            request().when().get("/auth/login").then().statusCode(200);
        }

        @Test
        @DisplayName("should protect the session API")
        void shouldProtectSessionApi() {
            request()
                    .when()
                    .get("/api/auth/session")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fapi%2Fauth%2Fsession");
        }

        @Test
        @DisplayName("should strip spoofed identity headers on pass-through routes")
        void shouldStripSpoofedHeaders() {
            request()
                    .header("x-user-id", "attacker")
                    .header("x-user-role", "ADMIN")
                    .when()
                    .get("/about")
                    .then()
                    .statusCode(200)
                    .body("$", anEmptyMap());
        }

        @Test
        @DisplayName("should leave health checks reachable")
        void shouldLeaveHealthReachable() {
            request()
                    .when()
                    .get("/q/health/ready")
                    .then()
                    .statusCode(200)
                    .body(containsString("session-signing-secret"));
        }
    }

    @Nested
    @DisplayName("With an unusable session")
    class Rejected {

        @Test
        @DisplayName("should delete a forged cookie and send to login")
        void shouldDeleteForgedCookie() {
            request()
                    .cookie("auth-token", "forged.artifact.value")
                    .when()
                    .get("/dashboard/sales")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fdashboard%2Fsales")
                    .header("Set-Cookie", containsString("auth-token="))
                    .header("Set-Cookie", containsString("Max-Age=0"));
        }

        @Test
        @DisplayName("should lock an unknown role out instead of looping on the landing page")
        void shouldLockOutUnknownRole() {
            request()
                    .cookie("auth-token", sessionFor("u-auditor"))
                    .when()
                    .get("/dashboard")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=%2Fdashboard")
                    .header("Set-Cookie", containsString("Max-Age=0"));
        }
    }

    @Nested
    @DisplayName("With a valid session")
    class Authenticated {

        @Test
        @DisplayName("should send a seller away from product pages and keep the cookie")
        void shouldDenySellerProducts() {
            request()
                    .cookie("auth-token", sessionFor("u-seller"))
                    .when()
                    .get("/dashboard/products")
                    .then()
                    .statusCode(307)
                    .header("Location", "/dashboard")
                    .header("Set-Cookie", nullValue());
        }

        @Test
        @DisplayName("should not let segment parameters carry a seller past the role policy")
        void shouldDenySellerParameterizedProducts() {
            request()
                    .urlEncodingEnabled(false)
                    .cookie("auth-token", sessionFor("u-seller"))
                    .when()
                    .get("/dashboard/products;x")
                    .then()
                    .statusCode(307)
                    .header("Location", "/dashboard");
        }

        @Test
        @DisplayName("should let a seller open the sales pages")
        void shouldAllowSellerSales() {
            request()
                    .cookie("auth-token", sessionFor("u-seller"))
                    .when()
                    .get("/dashboard/sales/new")
                    .then()
                    .statusCode(200)
                    .body("'x-user-role'", equalTo("SELLER"))
                    .body("'x-store-id'", equalTo("store-2"));
        }

        @Test
        @DisplayName("should send an admin without organization to onboarding")
        void shouldRequireOnboarding() {
            request()
                    .cookie("auth-token", sessionFor("u-new"))
                    .when()
                    .get("/dashboard")
                    .then()
                    .statusCode(307)
                    .header("Location", "/onboarding");
        }

        @Test
        @DisplayName("should send an onboarded admin away from onboarding")
        void shouldSkipCompletedOnboarding() {
            request()
                    .cookie("auth-token", sessionFor("u-admin"))
                    .when()
                    .get("/onboarding")
                    .then()
                    .statusCode(307)
                    .header("Location", "/dashboard");
        }

        @Test
        @DisplayName("should forward the verified identity to the page")
        void shouldForwardIdentity() {
            request()
                    .cookie("auth-token", sessionFor("u-admin"))
                    .header("x-user-id", "attacker")
                    .when()
                    .get("/dashboard/sales")
                    .then()
                    .statusCode(200)
                    .body("'x-user-id'", equalTo("u-admin"))
                    .body("'x-user-email'", equalTo("admin@stockgate.test"))
                    .body("'x-organization-id'", equalTo("org-1"));
        }

        @Test
        @DisplayName("should accept a session signed directly by the codec")
        void shouldAcceptCodecArtifact() {
            var token = codec.sign(new SessionSubject("u-admin", "admin@stockgate.test", "ADMIN", "org-1", null))
                    .token();

            request().cookie("auth-token", token).when().get("/").then().statusCode(200);
        }
    }

    @Test
    @DisplayName("should publish decision metrics")
    void shouldPublishMetrics() {
        request().when().get("/dashboard").then().statusCode(307);

        request()
                .when()
                .get("/q/metrics")
                .then()
                .statusCode(200)
                .body(containsString("stockgate_gateway_decisions_total"));
    }
}
