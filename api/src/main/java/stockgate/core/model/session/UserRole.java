package stockgate.core.model.session;

import java.util.Locale;

/**
 * Closed set of roles a store user can hold.
 *
 * <p>{@link #UNKNOWN} is never persisted; it stands in for any role string the
 * gateway does not recognize and carries no privileges.
 */
public enum UserRole {
    ADMIN,
    SELLER,
    UNKNOWN;

    /**
     * Parse a role claim.
     *
     * @param value raw role string from a token or snapshot (may be null)
     * @return the matching role, or {@link #UNKNOWN}
     */
    public static UserRole parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
