package stockgate.core.model.access;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Verified identity attached to an allowed request.
 *
 * <p>This is the request-scoped identity context: it is derived per request
 * from verified claims and handed to handlers, replacing any process-wide
 * user cache.
 *
 * @param userId user identifier
 * @param email user email
 * @param role role name as carried in the token
 * @param organizationId organization, or null
 * @param storeId store, or null
 */
public record IdentityAnnotation(String userId, String email, String role, String organizationId, String storeId) {

    public IdentityAnnotation {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (email == null) {
            email = "";
        }
        if (role == null) {
            role = "";
        }
    }

    /**
     * Headers to inject into the downstream request, in a stable order.
     * Organization and store headers are only present when assigned.
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(IdentityHeaders.USER_ID, userId);
        headers.put(IdentityHeaders.USER_EMAIL, email);
        headers.put(IdentityHeaders.USER_ROLE, role);
        if (organizationId != null && !organizationId.isBlank()) {
            headers.put(IdentityHeaders.ORGANIZATION_ID, organizationId);
        }
        if (storeId != null && !storeId.isBlank()) {
            headers.put(IdentityHeaders.STORE_ID, storeId);
        }
        return headers;
    }

    /**
     * Rebuild the annotation from headers previously injected by the gateway.
     *
     * @param headerLookup header accessor returning null when absent
     * @return the annotation, or empty if no user header is present
     */
    public static Optional<IdentityAnnotation> fromHeaders(Function<String, String> headerLookup) {
        String userId = headerLookup.apply(IdentityHeaders.USER_ID);
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new IdentityAnnotation(
                userId,
                headerLookup.apply(IdentityHeaders.USER_EMAIL),
                headerLookup.apply(IdentityHeaders.USER_ROLE),
                blankToNull(headerLookup.apply(IdentityHeaders.ORGANIZATION_ID)),
                blankToNull(headerLookup.apply(IdentityHeaders.STORE_ID))));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
