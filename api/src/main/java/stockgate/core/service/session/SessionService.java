package stockgate.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import stockgate.core.model.session.RequestMetadata;
import stockgate.core.model.session.SessionArtifact;
import stockgate.core.model.session.SessionSubject;
import stockgate.core.model.session.UserSnapshot;
import stockgate.core.port.in.SessionManagement;
import stockgate.core.port.out.Metrics;
import stockgate.core.port.out.UserSnapshotRepository;

/**
 * Mints session artifacts from the authoritative user snapshot.
 *
 * <p>This is the only component that performs I/O on behalf of sessions.
 * It runs outside the gateway's request path: the login flow calls
 * {@link #issueSession} after checking credentials, and application code
 * calls {@link #refreshSession} after changing attributes embedded in the
 * artifact (organization or store assignment, role).
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final UserSnapshotRepository userRepository;
    private final SessionTokenCodec codec;
    private final Metrics metrics;

    @Inject
    public SessionService(UserSnapshotRepository userRepository, SessionTokenCodec codec, Metrics metrics) {
        this.userRepository = userRepository;
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    public Uni<SessionArtifact> issueSession(String userId, RequestMetadata metadata) {
        return mint(userId, metadata, "issue");
    }

    @Override
    public Uni<SessionArtifact> refreshSession(String userId, RequestMetadata metadata) {
        return mint(userId, metadata, "refresh");
    }

    private Uni<SessionArtifact> mint(String userId, RequestMetadata metadata, String kind) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("User ID is required"));
        }
        RequestMetadata meta = metadata != null ? metadata : RequestMetadata.none();

        return userRepository.findById(userId).map(snapshotOpt -> {
            UserSnapshot snapshot =
                    snapshotOpt.orElseThrow(() -> new SnapshotNotFoundException(userId, "not_found"));
            if (snapshot.deleted()) {
                throw new SnapshotNotFoundException(userId, "deleted");
            }
            if (!snapshot.active()) {
                throw new SnapshotNotFoundException(userId, "inactive");
            }

            SessionArtifact artifact = codec.sign(SessionSubject.from(snapshot));
            metrics.recordSessionMinted(kind);
            LOG.infof(
                    "Session %s for user %s (role=%s, organization=%s) from ip=%s agent=%s",
                    kind, userId, snapshot.role(), snapshot.organizationId(), meta.ipAddress(), meta.userAgent());
            return artifact;
        });
    }
}
