package stockgate.core.port.out;

import stockgate.core.model.access.AccessDecision;

/**
 * Port interface for recording gateway metrics.
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the outcome of a gateway evaluation.
     *
     * @param decision the decision taken
     */
    void recordDecision(AccessDecision decision);

    /**
     * Record a session artifact that failed verification.
     *
     * @param reason the failure variant (e.g. "expired", "signature_invalid")
     */
    void recordVerificationFailure(String reason);

    /**
     * Record a minted session artifact.
     *
     * @param kind "issue" or "refresh"
     */
    void recordSessionMinted(String kind);
}
