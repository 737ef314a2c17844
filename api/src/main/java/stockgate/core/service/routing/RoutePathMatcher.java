package stockgate.core.service.routing;

import java.util.Collection;

/**
 * Segment-aware path prefix matching.
 *
 * <p>A path matches a route when it equals the route or continues it with a
 * {@code /}, so {@code /dashboards} does not match {@code /dashboard}.
 * The root route {@code /} only matches itself.
 */
public final class RoutePathMatcher {

    private RoutePathMatcher() {}

    /**
     * Check whether {@code path} is {@code route} or lies beneath it.
     *
     * @param path request path
     * @param route configured route
     * @return true if the path is within the route's subtree
     */
    public static boolean matches(String path, String route) {
        if (path == null || route == null || route.isEmpty()) {
            return false;
        }
        if (path.equals(route)) {
            return true;
        }
        String base = route.endsWith("/") ? route.substring(0, route.length() - 1) : route;
        if (base.isEmpty()) {
            return false;
        }
        return path.startsWith(base + "/");
    }

    /**
     * Remove {@code ;name=value} parameters from every segment of a path.
     *
     * <p>The JAX-RS layer dispatches on the path without them, so
     * {@code /dashboard;x=1} must be classified as {@code /dashboard}.
     *
     * @param path request path, may be null
     * @return the path without segment parameters
     */
    public static String stripSegmentParameters(String path) {
        if (path == null || path.indexOf(';') < 0) {
            return path;
        }
        StringBuilder stripped = new StringBuilder(path.length());
        boolean inParameters = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/') {
                inParameters = false;
                stripped.append(c);
            } else if (c == ';') {
                inParameters = true;
            } else if (!inParameters) {
                stripped.append(c);
            }
        }
        return stripped.toString();
    }

    /**
     * Check whether {@code path} matches any of the routes.
     */
    public static boolean matchesAny(String path, Collection<String> routes) {
        for (String route : routes) {
            if (matches(path, route)) {
                return true;
            }
        }
        return false;
    }
}
