package stockgate.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Pseudonymizes client addresses before they appear in security events.
 */
public final class SecureHash {

    static final String UNKNOWN_CLIENT = "unknown";

    private static final int IDENTIFIER_BYTES = 8;

    private SecureHash() {}

    /**
     * Stable pseudonym for a client address: the first 8 bytes of its SHA-256
     * digest, hex encoded. Surrounding whitespace is ignored.
     *
     * @param clientIp client address, may be null
     * @return 16 hex characters, or {@code "unknown"} when no address is known
     */
    public static String clientIdentifier(String clientIp) {
        if (clientIp == null || clientIp.isBlank()) {
            return UNKNOWN_CLIENT;
        }
        byte[] digest = sha256().digest(clientIp.strip().getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(Arrays.copyOf(digest, IDENTIFIER_BYTES));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
