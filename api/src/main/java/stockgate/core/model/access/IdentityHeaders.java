package stockgate.core.model.access;

import java.util.List;

/**
 * Names of the request headers carrying verified identity to downstream handlers.
 */
public final class IdentityHeaders {

    public static final String USER_ID = "x-user-id";
    public static final String USER_EMAIL = "x-user-email";
    public static final String USER_ROLE = "x-user-role";
    public static final String ORGANIZATION_ID = "x-organization-id";
    public static final String STORE_ID = "x-store-id";

    /**
     * Every identity header. Incoming copies of these are discarded before
     * the gateway decides, so only verified values reach handlers.
     */
    public static final List<String> ALL = List.of(USER_ID, USER_EMAIL, USER_ROLE, ORGANIZATION_ID, STORE_ID);

    private IdentityHeaders() {}
}
