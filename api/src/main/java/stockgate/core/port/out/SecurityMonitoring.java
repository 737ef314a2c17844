package stockgate.core.port.out;

/**
 * Port interface for reporting security-relevant gateway events.
 */
public interface SecurityMonitoring {

    /**
     * Check if security monitoring is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a session artifact that could not be used.
     *
     * @param clientIp the client IP address
     * @param reason the reason for the failure
     * @param path the requested path
     */
    void recordAuthFailure(String clientIp, String reason, String path);

    /**
     * Record an authenticated request refused by role policy.
     *
     * @param clientIp the client IP address
     * @param userId the refused user
     * @param role the refused role
     * @param path the requested path
     */
    void recordAccessDenied(String clientIp, String userId, String role, String path);

    /**
     * Record a session cookie being cleared.
     *
     * @param clientIp the client IP address
     * @param userId the user, if known (may be null)
     * @param reason "logout" or the verification failure reason
     */
    void recordSessionInvalidated(String clientIp, String userId, String reason);
}
