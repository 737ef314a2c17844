package stockgate.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IdentityAnnotation")
class IdentityAnnotationTest {

    @Test
    @DisplayName("should emit headers in a stable order")
    void shouldEmitHeadersInOrder() {
        var identity = new IdentityAnnotation("u-1", "a@example.com", "ADMIN", "org-1", "store-1");

        var headers = identity.toHeaders();

        assertEquals(List.copyOf(IdentityHeaders.ALL), List.copyOf(headers.keySet()));
        assertEquals("store-1", headers.get(IdentityHeaders.STORE_ID));
    }

    @Test
    @DisplayName("should omit organization and store headers when unassigned")
    void shouldOmitUnassignedHeaders() {
        var headers = new IdentityAnnotation("u-1", "a@example.com", "SELLER", null, "").toHeaders();

        assertEquals(3, headers.size());
        assertEquals("SELLER", headers.get(IdentityHeaders.USER_ROLE));
    }

    @Test
    @DisplayName("should rebuild itself from injected headers")
    void shouldRoundTripThroughHeaders() {
        var identity = new IdentityAnnotation("u-1", "a@example.com", "SELLER", "org-1", null);
        Map<String, String> headers = identity.toHeaders();

        var rebuilt = IdentityAnnotation.fromHeaders(headers::get).orElseThrow();

        assertEquals(identity, rebuilt);
        assertNull(rebuilt.storeId());
    }

    @Test
    @DisplayName("should be absent when no user header is present")
    void shouldBeEmptyWithoutUserHeader() {
        assertTrue(IdentityAnnotation.fromHeaders(name -> null).isEmpty());
    }

    @Test
    @DisplayName("should require a user ID")
    void shouldRequireUserId() {
        assertThrows(IllegalArgumentException.class, () -> new IdentityAnnotation(" ", "e", "ADMIN", null, null));
    }

    @Test
    @DisplayName("should default a missing email and role to empty strings")
    void shouldDefaultMissingEmailAndRole() {
        var identity = new IdentityAnnotation("u-1", null, null, null, null);

        assertEquals("", identity.email());
        assertEquals("", identity.role());
    }
}
