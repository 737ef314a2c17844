package stockgate.core.service.routing;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import stockgate.core.config.RouteConfig;
import stockgate.core.model.routing.RouteCategory;
import stockgate.core.model.routing.RouteClassification;

/**
 * Maps a request path to exactly one {@link RouteCategory}.
 *
 * <p>Segment parameters ({@code ;name=value}) are removed before matching.
 * Precedence, first match wins:
 * <ol>
 *   <li>static assets: configured prefixes anywhere, file extensions only
 *       outside the onboarding and dashboard subtrees</li>
 *   <li>public routes</li>
 *   <li>protected API routes</li>
 *   <li>the bare root path</li>
 *   <li>the onboarding subtree</li>
 *   <li>the dashboard subtree</li>
 *   <li>everything else is unclassified</li>
 * </ol>
 *
 * <p>Route tables are copied at construction and never change afterwards.
 */
@ApplicationScoped
public class RouteClassifier {

    private static final Logger LOG = Logger.getLogger(RouteClassifier.class);

    private static final String ROOT = "/";

    private final List<String> publicRoutes;
    private final List<String> protectedApiRoutes;
    private final String dashboardPath;
    private final String onboardingPath;
    private final List<String> staticPrefixes;
    private final Set<String> staticExtensions;

    @Inject
    public RouteClassifier(RouteConfig config) {
        this.publicRoutes = List.copyOf(config.publicRoutes());
        this.protectedApiRoutes = List.copyOf(config.protectedApiRoutes());
        this.dashboardPath = config.dashboardPath();
        this.onboardingPath = config.onboardingPath();
        this.staticPrefixes = List.copyOf(config.staticAssets().prefixes());
        this.staticExtensions = config.staticAssets().extensions().stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toUnmodifiableSet());

        LOG.debugf(
                "Route classifier initialized: %d public, %d protected API, dashboard=%s, onboarding=%s",
                publicRoutes.size(), protectedApiRoutes.size(), dashboardPath, onboardingPath);
    }

    /**
     * Classify a request path.
     *
     * @param rawPath request path without query string (null or empty means root)
     * @return the classification, carrying the path as matched
     */
    public RouteClassification classify(String rawPath) {
        String stripped = RoutePathMatcher.stripSegmentParameters(rawPath);
        String path = stripped == null || stripped.isEmpty() ? ROOT : stripped;
        return new RouteClassification(path, categorize(path));
    }

    private RouteCategory categorize(String path) {
        if (RoutePathMatcher.matchesAny(path, staticPrefixes)) {
            return RouteCategory.STATIC_ASSET;
        }
        boolean pageSubtree =
                RoutePathMatcher.matches(path, onboardingPath) || RoutePathMatcher.matches(path, dashboardPath);
        if (!pageSubtree && hasStaticExtension(path)) {
            return RouteCategory.STATIC_ASSET;
        }
        if (RoutePathMatcher.matchesAny(path, publicRoutes)) {
            return RouteCategory.PUBLIC;
        }
        if (RoutePathMatcher.matchesAny(path, protectedApiRoutes)) {
            return RouteCategory.PROTECTED_API;
        }
        if (ROOT.equals(path)) {
            return RouteCategory.ROOT;
        }
        if (RoutePathMatcher.matches(path, onboardingPath)) {
            return RouteCategory.ONBOARDING;
        }
        if (RoutePathMatcher.matches(path, dashboardPath)) {
            return RouteCategory.DASHBOARD;
        }
        return RouteCategory.UNCLASSIFIED;
    }

    private boolean hasStaticExtension(String path) {
        int lastSlash = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        if (lastDot <= lastSlash + 1 || lastDot == path.length() - 1) {
            return false;
        }
        return staticExtensions.contains(path.substring(lastDot + 1).toLowerCase(Locale.ROOT));
    }
}
