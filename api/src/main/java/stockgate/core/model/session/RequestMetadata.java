package stockgate.core.model.session;

/**
 * Request details recorded when a session artifact is minted.
 *
 * <p>Only used for audit logging; never embedded in the artifact.
 *
 * @param ipAddress client IP address (optional)
 * @param userAgent client user agent (optional)
 */
public record RequestMetadata(String ipAddress, String userAgent) {

    private static final RequestMetadata NONE = new RequestMetadata(null, null);

    public static RequestMetadata none() {
        return NONE;
    }
}
