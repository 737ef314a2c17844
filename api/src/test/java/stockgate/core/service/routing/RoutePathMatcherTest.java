package stockgate.core.service.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("RoutePathMatcher")
class RoutePathMatcherTest {

    @ParameterizedTest(name = "{0} matches {1}")
    @CsvSource({
        "/dashboard, /dashboard",
        "/dashboard/, /dashboard",
        "/dashboard/sales, /dashboard",
        "/dashboard/sales/42, /dashboard/sales",
        "/dashboard/sales, /dashboard/"
    })
    @DisplayName("should match the route itself and paths beneath it")
    void shouldMatchSubtree(String path, String route) {
        assertTrue(RoutePathMatcher.matches(path, route));
    }

    @ParameterizedTest(name = "{0} does not match {1}")
    @CsvSource({
        "/dashboards, /dashboard",
        "/dashboard-old, /dashboard",
        "/dash, /dashboard",
        "/auth/loginx, /auth/login",
        "/other, /"
    })
    @DisplayName("should not match sibling paths sharing a prefix")
    void shouldNotMatchSiblings(String path, String route) {
        assertFalse(RoutePathMatcher.matches(path, route));
    }

    @Test
    @DisplayName("root route should only match the root path")
    void rootShouldOnlyMatchItself() {
        assertTrue(RoutePathMatcher.matches("/", "/"));
        assertFalse(RoutePathMatcher.matches("/dashboard", "/"));
    }

    @Test
    @DisplayName("should not match null inputs")
    void shouldRejectNulls() {
        assertFalse(RoutePathMatcher.matches(null, "/dashboard"));
        assertFalse(RoutePathMatcher.matches("/dashboard", null));
    }

    @Test
    @DisplayName("matchesAny should check every route")
    void matchesAnyShouldCheckEveryRoute() {
        var routes = List.of("/auth/login", "/auth/register");

        assertTrue(RoutePathMatcher.matchesAny("/auth/register/confirm", routes));
        assertFalse(RoutePathMatcher.matchesAny("/auth/logout", routes));
        assertFalse(RoutePathMatcher.matchesAny("/auth/login", List.of()));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "/dashboard;x=1, /dashboard",
        "/dashboard/products;x, /dashboard/products",
        "/dashboard;a=1/sales;b=2/42, /dashboard/sales/42",
        "/;jsessionid=1, /",
        "/dashboard/sales, /dashboard/sales"
    })
    @DisplayName("should strip segment parameters")
    void shouldStripSegmentParameters(String path, String expected) {
        assertEquals(expected, RoutePathMatcher.stripSegmentParameters(path));
    }

    @Test
    @DisplayName("should leave a null path alone when stripping")
    void shouldStripNullToNull() {
        assertNull(RoutePathMatcher.stripSegmentParameters(null));
    }
}
