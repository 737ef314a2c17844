package stockgate.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Test
    @DisplayName("should use the leading bytes of the SHA-256 digest")
    void shouldUseDigestPrefix() {
        // SHA-256("abc") = ba7816bf8f01cfea...
        assertEquals("ba7816bf8f01cfea", SecureHash.clientIdentifier("abc"));
    }

    @Test
    @DisplayName("should give the same address the same identifier regardless of padding")
    void shouldBeStable() {
        assertEquals(SecureHash.clientIdentifier("203.0.113.5"), SecureHash.clientIdentifier(" 203.0.113.5 "));
        assertNotEquals(SecureHash.clientIdentifier("203.0.113.5"), SecureHash.clientIdentifier("203.0.113.6"));
    }

    @Test
    @DisplayName("should hash client addresses and mark missing ones")
    void shouldHashClientIdentifier() {
        assertEquals(16, SecureHash.clientIdentifier("203.0.113.5").length());
        assertNotEquals("203.0.113.5", SecureHash.clientIdentifier("203.0.113.5"));
        assertEquals(SecureHash.UNKNOWN_CLIENT, SecureHash.clientIdentifier(null));
        assertEquals(SecureHash.UNKNOWN_CLIENT, SecureHash.clientIdentifier(""));
    }
}
