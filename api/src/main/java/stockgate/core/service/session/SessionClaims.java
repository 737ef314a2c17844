package stockgate.core.service.session;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import stockgate.core.model.access.IdentityAnnotation;

/**
 * Claims recovered from a session artifact whose signature and expiration
 * were both checked.
 *
 * <p>Instances can only be created by {@link SessionTokenCodec#verify(String)};
 * no other code path may synthesize claims.
 */
public final class SessionClaims {

    private final String userId;
    private final String email;
    private final String role;
    private final String organizationId;
    private final String storeId;
    private final Instant issuedAt;
    private final Instant expiresAt;

    SessionClaims(
            String userId,
            String email,
            String role,
            String organizationId,
            String storeId,
            Instant issuedAt,
            Instant expiresAt) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.email = email;
        this.role = role;
        this.organizationId = organizationId;
        this.storeId = storeId;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String userId() {
        return userId;
    }

    public String email() {
        return email;
    }

    /**
     * Role name exactly as carried in the token.
     */
    public String role() {
        return role;
    }

    public Optional<String> organizationId() {
        return Optional.ofNullable(organizationId);
    }

    public Optional<String> storeId() {
        return Optional.ofNullable(storeId);
    }

    /**
     * Onboarding is complete once an organization is assigned.
     */
    public boolean hasCompletedOnboarding() {
        return organizationId != null;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public IdentityAnnotation toIdentity() {
        return new IdentityAnnotation(userId, email, role, organizationId, storeId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionClaims other)) {
            return false;
        }
        return userId.equals(other.userId)
                && Objects.equals(email, other.email)
                && Objects.equals(role, other.role)
                && Objects.equals(organizationId, other.organizationId)
                && Objects.equals(storeId, other.storeId)
                && issuedAt.equals(other.issuedAt)
                && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email, role, organizationId, storeId, issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "SessionClaims[userId=" + userId + ", role=" + role + ", organizationId=" + organizationId
                + ", storeId=" + storeId + ", expiresAt=" + expiresAt + "]";
    }
}
