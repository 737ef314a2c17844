package stockgate.core.service.session;

/**
 * Result of verifying a session artifact.
 *
 * <p>Callers treat every failure variant the same way; the variants exist so
 * that logs and metrics can tell them apart.
 */
public sealed interface VerificationResult {

    /**
     * Short, stable name of the result for logs and metric tags.
     */
    String reason();

    default boolean isValid() {
        return false;
    }

    /**
     * Artifact is authentic, well-formed and unexpired.
     *
     * @param claims the verified claims
     */
    record Valid(SessionClaims claims) implements VerificationResult {

        public Valid {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }

        @Override
        public String reason() {
            return "valid";
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * Artifact was authentic but its expiration time has passed.
     */
    record Expired() implements VerificationResult {
        @Override
        public String reason() {
            return "expired";
        }
    }

    /**
     * Artifact could not be parsed, or its claims are missing or of the wrong type.
     *
     * @param detail what was wrong, for logs only
     */
    record Malformed(String detail) implements VerificationResult {
        @Override
        public String reason() {
            return "malformed";
        }
    }

    /**
     * Artifact signature does not match the configured secret.
     */
    record SignatureInvalid() implements VerificationResult {
        @Override
        public String reason() {
            return "signature_invalid";
        }
    }

    /**
     * No usable signing secret is configured; nothing can be verified.
     */
    record MissingSecret() implements VerificationResult {
        @Override
        public String reason() {
            return "missing_secret";
        }
    }
}
