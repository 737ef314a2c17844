package stockgate.core.model.session;

/**
 * Authoritative, read-only view of a user as held by the user store.
 *
 * <p>Session issuance and refresh build claims exclusively from this record,
 * never from claims presented by the client.
 *
 * @param userId stable user identifier
 * @param email user email (informational)
 * @param role role name as stored
 * @param organizationId assigned organization, or null while onboarding
 * @param storeId assigned store, or null
 * @param active whether the account is enabled
 * @param deleted whether the account has been soft-deleted
 */
public record UserSnapshot(
        String userId,
        String email,
        String role,
        String organizationId,
        String storeId,
        boolean active,
        boolean deleted) {

    public UserSnapshot {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
    }

    public UserSnapshot withOrganization(String organizationId, String storeId) {
        return new UserSnapshot(userId, email, role, organizationId, storeId, active, deleted);
    }

    public UserSnapshot withActive(boolean active) {
        return new UserSnapshot(userId, email, role, organizationId, storeId, active, deleted);
    }
}
