package stockgate.spi;

import java.time.Instant;

/**
 * Security events raised by the session gateway.
 *
 * <p>Events are dispatched to registered {@link SecurityEventHandler}
 * implementations for logging, metrics and alerting.
 *
 * <ul>
 *   <li>{@link AuthenticationFailure} - a presented session artifact was rejected</li>
 *   <li>{@link AccessDenied} - role policy refused an authenticated user</li>
 *   <li>{@link SessionInvalidated} - a session cookie was deleted</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    /**
     * When the event occurred.
     */
    Instant timestamp();

    /**
     * Hashed client address.
     */
    String clientIdentifier();

    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Normal operation (logout, expired session). */
        INFO,
        /** Needs attention (forged or tampered artifacts). */
        WARNING,
        /** Needs immediate action (gateway cannot verify anything). */
        CRITICAL
    }

    /**
     * A session artifact failed verification.
     *
     * @param timestamp when the failure occurred
     * @param clientIdentifier hashed client address
     * @param reason verification result name (e.g. "expired", "signature_invalid")
     * @param path the requested path
     */
    record AuthenticationFailure(Instant timestamp, String clientIdentifier, String reason, String path)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            if ("missing_secret".equals(reason)) {
                return Severity.CRITICAL;
            }
            if ("signature_invalid".equals(reason) || "malformed".equals(reason)) {
                return Severity.WARNING;
            }
            return Severity.INFO;
        }
    }

    /**
     * An authenticated user was refused by role policy.
     *
     * @param timestamp when access was denied
     * @param clientIdentifier hashed client address
     * @param userId the refused user
     * @param role the user's role as carried in the session
     * @param path the requested path
     */
    record AccessDenied(Instant timestamp, String clientIdentifier, String userId, String role, String path)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * A session cookie was deleted.
     *
     * @param timestamp when the session was invalidated
     * @param clientIdentifier hashed client address
     * @param userId the user, when known
     * @param reason invalidation reason (e.g. "logout", "expired", "no_accessible_landing")
     */
    record SessionInvalidated(Instant timestamp, String clientIdentifier, String userId, String reason)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return "no_accessible_landing".equals(reason) ? Severity.WARNING : Severity.INFO;
        }
    }
}
