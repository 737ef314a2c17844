package stockgate.core.service.session;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import stockgate.core.config.SessionConfig;
import stockgate.core.model.session.SessionArtifact;
import stockgate.core.model.session.SessionSubject;

/**
 * Signs and verifies session artifacts.
 *
 * <p>Artifacts are compact HS256 JWS tokens whose payload carries the user's
 * identity, role and organization assignment plus {@code iat}/{@code exp}.
 * Verification is a pure function of the token, the configured secret and
 * the clock: no I/O and no shared mutable state.
 */
@ApplicationScoped
public class SessionTokenCodec {

    private static final Logger LOG = Logger.getLogger(SessionTokenCodec.class);

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_ORGANIZATION_ID = "organizationId";
    static final String CLAIM_STORE_ID = "storeId";

    private static final VerificationResult MISSING_SECRET = new VerificationResult.MissingSecret();
    private static final VerificationResult EXPIRED = new VerificationResult.Expired();
    private static final VerificationResult SIGNATURE_INVALID = new VerificationResult.SignatureInvalid();

    private final SessionConfig config;
    private final Clock clock;
    private final HmacKey signingKey;
    private final String secretProblem;

    @Inject
    public SessionTokenCodec(SessionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        Optional<String> secret = config.secret().filter(s -> !s.isBlank());
        if (secret.isEmpty()) {
            secretProblem = "No session signing secret configured (stockgate.session.secret / JWT_SECRET)";
            signingKey = null;
            LOG.error(secretProblem);
        } else if (secret.get().length() < SessionConfig.MIN_SECRET_LENGTH) {
            secretProblem = "Session signing secret must be at least " + SessionConfig.MIN_SECRET_LENGTH
                    + " characters long, got " + secret.get().length();
            signingKey = null;
            LOG.error(secretProblem);
        } else {
            secretProblem = null;
            signingKey = new HmacKey(secret.get().getBytes(StandardCharsets.UTF_8));
            LOG.debug("Session token codec initialized with HS256 signing secret");
        }
    }

    /**
     * Sign a session artifact for the given subject.
     *
     * <p>{@code iat} is the current instant truncated to seconds and
     * {@code exp} is {@code iat + ttl}.
     *
     * @param subject the identity to embed
     * @return the signed artifact
     * @throws SessionConfigurationException if no usable secret is configured
     */
    public SessionArtifact sign(SessionSubject subject) {
        if (signingKey == null) {
            throw new SessionConfigurationException(secretProblem);
        }

        Instant issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant expiresAt = issuedAt.plus(config.ttl());

        JwtClaims claims = new JwtClaims();
        claims.setStringClaim(CLAIM_USER_ID, subject.userId());
        claims.setStringClaim(CLAIM_EMAIL, subject.email());
        if (subject.role() != null) {
            claims.setStringClaim(CLAIM_ROLE, subject.role());
        }
        if (subject.organizationId() != null) {
            claims.setStringClaim(CLAIM_ORGANIZATION_ID, subject.organizationId());
        }
        if (subject.storeId() != null) {
            claims.setStringClaim(CLAIM_STORE_ID, subject.storeId());
        }
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(signingKey);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setHeader("typ", "JWT");

        try {
            String token = jws.getCompactSerialization();
            LOG.debugf("Signed session artifact for user %s, expires at %s", subject.userId(), expiresAt);
            return new SessionArtifact(token, subject.userId(), issuedAt, expiresAt);
        } catch (JoseException e) {
            throw new SessionConfigurationException("Failed to sign session artifact", e);
        }
    }

    /**
     * Verify a session artifact.
     *
     * @param token compact serialization from the cookie
     * @return {@link VerificationResult.Valid} with the claims, or a failure variant
     */
    public VerificationResult verify(String token) {
        if (signingKey == null) {
            return MISSING_SECRET;
        }
        if (token == null || token.isBlank()) {
            return new VerificationResult.Malformed("Empty token");
        }

        Instant now = clock.instant();
        JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setEvaluationTime(NumericDate.fromMilliseconds(now.toEpochMilli()))
                .setSkipDefaultAudienceValidation()
                .setVerificationKey(signingKey)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();

        JwtClaims jwtClaims;
        try {
            jwtClaims = consumer.processToClaims(token);
        } catch (InvalidJwtException e) {
            return classify(e);
        }

        return toClaims(jwtClaims, now);
    }

    /**
     * Whether artifacts can be signed and verified.
     */
    public boolean isSigningAvailable() {
        return signingKey != null;
    }

    /**
     * Why signing is unavailable, if it is.
     */
    public Optional<String> signingProblem() {
        return Optional.ofNullable(secretProblem);
    }

    private VerificationResult classify(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return SIGNATURE_INVALID;
        }
        if (e.hasExpired()) {
            return EXPIRED;
        }
        return new VerificationResult.Malformed(summarize(e));
    }

    private VerificationResult toClaims(JwtClaims jwtClaims, Instant now) {
        try {
            String userId = jwtClaims.getStringClaimValue(CLAIM_USER_ID);
            if (userId == null || userId.isBlank()) {
                return new VerificationResult.Malformed("Missing userId claim");
            }
            String email = jwtClaims.getStringClaimValue(CLAIM_EMAIL);
            if (email == null) {
                email = "";
            }
            String role = jwtClaims.getStringClaimValue(CLAIM_ROLE);
            String organizationId = blankToNull(jwtClaims.getStringClaimValue(CLAIM_ORGANIZATION_ID));
            String storeId = blankToNull(jwtClaims.getStringClaimValue(CLAIM_STORE_ID));

            Instant issuedAt = Instant.ofEpochSecond(jwtClaims.getIssuedAt().getValue());
            Instant expiresAt = Instant.ofEpochSecond(jwtClaims.getExpirationTime().getValue());
            if (!now.isBefore(expiresAt)) {
                return EXPIRED;
            }

            return new VerificationResult.Valid(
                    new SessionClaims(userId, email, role, organizationId, storeId, issuedAt, expiresAt));
        } catch (MalformedClaimException e) {
            return new VerificationResult.Malformed("Malformed claims: " + e.getMessage());
        }
    }

    private String summarize(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.EXPIRATION_MISSING)) {
            return "Missing exp claim";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUED_AT_MISSING)) {
            return "Missing iat claim";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return "Token is not signed";
        }
        return "Token could not be processed";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
