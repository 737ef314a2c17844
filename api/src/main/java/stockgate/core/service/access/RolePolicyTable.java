package stockgate.core.service.access;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import stockgate.core.model.access.Capability;
import stockgate.core.model.access.RouteGrant;
import stockgate.core.model.session.UserRole;
import stockgate.core.service.routing.RoutePathMatcher;

/**
 * Static role policy: which dashboard paths and which capabilities each role holds.
 *
 * <p>This table is the single place role checks are written down. Nothing
 * else compares role names. The table is built once and never mutated.
 *
 * <ul>
 *   <li>{@code ADMIN} - every dashboard path, every capability</li>
 *   <li>{@code SELLER} - the dashboard landing page and the sales subtree, no capabilities</li>
 *   <li>anything else - nothing</li>
 * </ul>
 */
@ApplicationScoped
public class RolePolicyTable {

    private static final Map<UserRole, List<RouteGrant>> ROUTE_GRANTS;
    private static final Map<UserRole, Set<Capability>> CAPABILITIES;

    static {
        Map<UserRole, List<RouteGrant>> grants = new EnumMap<>(UserRole.class);
        grants.put(UserRole.SELLER, List.of(RouteGrant.page("/dashboard"), RouteGrant.subtree("/dashboard/sales")));
        ROUTE_GRANTS = Map.copyOf(grants);

        Map<UserRole, Set<Capability>> capabilities = new EnumMap<>(UserRole.class);
        capabilities.put(UserRole.ADMIN, Collections.unmodifiableSet(EnumSet.allOf(Capability.class)));
        CAPABILITIES = Map.copyOf(capabilities);
    }

    /**
     * Whether {@code role} may open {@code path}.
     *
     * @param role role name as carried in the session (may be null or unknown)
     * @param path dashboard path
     * @return true if allowed; unknown roles are always denied
     */
    public boolean isAllowed(String role, String path) {
        return isAllowed(UserRole.parse(role), path);
    }

    public boolean isAllowed(UserRole role, String path) {
        if (role == UserRole.ADMIN) {
            return true;
        }
        for (RouteGrant grant : routeGrants(role)) {
            if (grant.includeSubtree() ? RoutePathMatcher.matches(path, grant.path()) : grant.path().equals(path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Explicit route grants of a role. Empty for ADMIN, whose access is implicit.
     */
    public List<RouteGrant> routeGrants(UserRole role) {
        return ROUTE_GRANTS.getOrDefault(role, List.of());
    }

    /**
     * Whether {@code role} holds {@code capability}.
     */
    public boolean hasCapability(String role, Capability capability) {
        return capabilities(role).contains(capability);
    }

    /**
     * All capabilities of a role, empty for unknown roles.
     */
    public Set<Capability> capabilities(String role) {
        return CAPABILITIES.getOrDefault(UserRole.parse(role), Set.of());
    }
}
