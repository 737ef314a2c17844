package stockgate.core.model.routing;

/**
 * Result of classifying a request path.
 *
 * @param path the normalized request path
 * @param category the category the path falls into
 */
public record RouteClassification(String path, RouteCategory category) {

    public RouteClassification {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
    }

    public boolean requiresSession() {
        return category.requiresSession();
    }

    public boolean isDashboard() {
        return category == RouteCategory.DASHBOARD;
    }

    public boolean isOnboarding() {
        return category == RouteCategory.ONBOARDING;
    }
}
