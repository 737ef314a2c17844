package stockgate.core.model.session;

/**
 * Identity data that gets signed into a session artifact.
 *
 * @param userId stable user identifier (required)
 * @param email user email (informational)
 * @param role role name
 * @param organizationId organization assignment, or null
 * @param storeId store assignment, or null
 */
public record SessionSubject(String userId, String email, String role, String organizationId, String storeId) {

    public SessionSubject {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (email == null) {
            email = "";
        }
    }

    /**
     * Build the signable subject from a freshly loaded snapshot.
     */
    public static SessionSubject from(UserSnapshot snapshot) {
        return new SessionSubject(
                snapshot.userId(), snapshot.email(), snapshot.role(), snapshot.organizationId(), snapshot.storeId());
    }
}
