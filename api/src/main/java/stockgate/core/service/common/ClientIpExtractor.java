package stockgate.core.service.common;

import java.util.function.Function;

/**
 * Resolves the originating client address of a request.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>{@code X-Forwarded-For} (first address in the chain)</li>
 *   <li>{@code X-Real-IP}</li>
 *   <li>the socket's remote address</li>
 * </ol>
 */
public final class ClientIpExtractor {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";

    private ClientIpExtractor() {}

    /**
     * Extract the client address.
     *
     * @param headerLookup header accessor returning null when absent
     * @param remoteAddress socket remote address, may be null
     * @return the client address, or null if not available
     */
    public static String extract(Function<String, String> headerLookup, String remoteAddress) {
        var forwardedFor = headerLookup.apply(X_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            var first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        var realIp = headerLookup.apply(X_REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        return remoteAddress;
    }
}
