package stockgate.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import stockgate.config.UserSeedConfigMapping;
import stockgate.core.model.session.UserSnapshot;
import stockgate.core.port.out.UserSnapshotRepository;

/**
 * In-memory implementation of UserSnapshotRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Users are lost on restart and not shared across instances.
 */
@ApplicationScoped
public class InMemoryUserSnapshotRepository implements UserSnapshotRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryUserSnapshotRepository.class);

    private final ConcurrentMap<String, UserSnapshot> users = new ConcurrentHashMap<>();

    @Inject
    public InMemoryUserSnapshotRepository(UserSeedConfigMapping seedConfig) {
        seedConfig.seed().forEach((userId, seed) -> users.put(
                userId,
                new UserSnapshot(
                        userId,
                        seed.email(),
                        seed.role(),
                        seed.organizationId().orElse(null),
                        seed.storeId().orElse(null),
                        seed.active(),
                        seed.deleted())));
        if (!users.isEmpty()) {
            LOG.infof("Seeded in-memory user store with %d user(s)", users.size());
        }
    }

    @Override
    public Uni<Optional<UserSnapshot>> findById(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(users.get(userId)));
    }

    @Override
    public Uni<UserSnapshot> save(UserSnapshot snapshot) {
        return Uni.createFrom().item(() -> {
            users.put(snapshot.userId(), snapshot);
            LOG.debugf("User snapshot saved: %s", snapshot.userId());
            return snapshot;
        });
    }
}
