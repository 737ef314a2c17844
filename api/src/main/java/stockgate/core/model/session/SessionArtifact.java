package stockgate.core.model.session;

import java.time.Instant;

/**
 * A signed session token ready to be handed to the client.
 *
 * @param token compact JWS serialization
 * @param userId the user the token was minted for
 * @param issuedAt token issue instant
 * @param expiresAt token expiration instant
 */
public record SessionArtifact(String token, String userId, Instant issuedAt, Instant expiresAt) {}
