package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode entities.
 */
public interface AuthorizationCodeRepository {

    /**
     * Find a code by hash whatever its state, so replays can be recognised.
     */
    Optional<AuthorizationCode> findByCodeHash(String codeHash);

    void persist(AuthorizationCode code);

    /**
     * Atomically mark an unconsumed, unexpired code as consumed.
     *
     * @return true if this call consumed it, false if it was already consumed or expired
     */
    boolean markConsumed(String codeHash, Instant now);

    long deleteExpired(Instant now);
}
