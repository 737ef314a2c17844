package stockgate.core.model.routing;

/**
 * Category a request path falls into, in order of classification precedence.
 */
public enum RouteCategory {
    /** Build artifacts, images, fonts; never evaluated by the gateway. */
    STATIC_ASSET(false),
    /** Login, registration and password reset pages and APIs. */
    PUBLIC(false),
    /** API endpoints that need a session but are not page navigations. */
    PROTECTED_API(true),
    /** The bare root page. */
    ROOT(true),
    /** The onboarding subtree. */
    ONBOARDING(true),
    /** The dashboard subtree. */
    DASHBOARD(true),
    /** Anything else; passes through untouched. */
    UNCLASSIFIED(false);

    private final boolean requiresSession;

    RouteCategory(boolean requiresSession) {
        this.requiresSession = requiresSession;
    }

    public boolean requiresSession() {
        return requiresSession;
    }
}
