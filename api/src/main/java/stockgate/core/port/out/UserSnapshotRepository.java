package stockgate.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import stockgate.core.model.session.UserSnapshot;

/**
 * Outbound port to the user store.
 *
 * <p>The gateway never calls this port; only session issuance and refresh do.
 */
public interface UserSnapshotRepository {

    /**
     * Load the current snapshot of a user.
     *
     * @param userId user identifier
     * @return the snapshot, or empty if no such user exists
     */
    Uni<Optional<UserSnapshot>> findById(String userId);

    /**
     * Store or replace a snapshot.
     *
     * @param snapshot snapshot to store
     * @return the stored snapshot
     */
    Uni<UserSnapshot> save(UserSnapshot snapshot);
}
