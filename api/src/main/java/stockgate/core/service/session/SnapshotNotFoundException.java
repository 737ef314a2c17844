package stockgate.core.service.session;

/**
 * Thrown when no session may be minted because the user snapshot is missing,
 * deleted or inactive.
 */
public class SnapshotNotFoundException extends RuntimeException {

    private final String userId;
    private final String reason;

    public SnapshotNotFoundException(String userId, String reason) {
        super("User not found or inactive: " + userId);
        this.userId = userId;
        this.reason = reason;
    }

    public String userId() {
        return userId;
    }

    /**
     * One of "not_found", "deleted" or "inactive".
     */
    public String reason() {
        return reason;
    }
}
