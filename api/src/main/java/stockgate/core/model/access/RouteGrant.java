package stockgate.core.model.access;

/**
 * A single path a role may open.
 *
 * @param path the granted path
 * @param includeSubtree whether paths beneath {@code path} are granted too
 */
public record RouteGrant(String path, boolean includeSubtree) {

    public RouteGrant {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Granted path must start with '/': " + path);
        }
    }

    /** Grant exactly one page. */
    public static RouteGrant page(String path) {
        return new RouteGrant(path, false);
    }

    /** Grant a page and everything beneath it. */
    public static RouteGrant subtree(String path) {
        return new RouteGrant(path, true);
    }
}
