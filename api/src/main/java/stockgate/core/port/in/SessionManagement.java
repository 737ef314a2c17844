package stockgate.core.port.in;

import io.smallrye.mutiny.Uni;

import stockgate.core.model.session.RequestMetadata;
import stockgate.core.model.session.SessionArtifact;

/**
 * Inbound port for minting session artifacts.
 *
 * <p>Both operations load the authoritative user snapshot and sign claims
 * from it. Neither accepts claims from the caller. They are invoked by
 * trusted application code, never by the gateway itself.
 */
public interface SessionManagement {

    /**
     * Mint the first artifact for a user whose credentials were just verified.
     *
     * @param userId user identifier
     * @param metadata request metadata for audit logging
     * @return the signed artifact
     * @throws stockgate.core.service.session.SnapshotNotFoundException (as a failed Uni)
     *         if the user does not exist, was deleted or is inactive
     */
    Uni<SessionArtifact> issueSession(String userId, RequestMetadata metadata);

    /**
     * Re-mint an artifact after attributes embedded in it changed,
     * for example when an organization is assigned during onboarding.
     *
     * @param userId user identifier
     * @param metadata request metadata for audit logging
     * @return the freshly signed artifact with a renewed TTL
     * @throws stockgate.core.service.session.SnapshotNotFoundException (as a failed Uni)
     *         if the user does not exist, was deleted or is inactive
     */
    Uni<SessionArtifact> refreshSession(String userId, RequestMetadata metadata);
}
