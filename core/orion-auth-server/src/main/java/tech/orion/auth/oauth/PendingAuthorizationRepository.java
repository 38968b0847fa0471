package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for PendingAuthorization entities.
 */
public interface PendingAuthorizationRepository {

    Optional<PendingAuthorization> findPending(String id);

    void persist(PendingAuthorization pending);

    /**
     * Delete the request so it cannot be decided twice.
     *
     * @return true if this call removed it
     */
    boolean consume(String id);

    long deleteExpired(Instant now);
}
