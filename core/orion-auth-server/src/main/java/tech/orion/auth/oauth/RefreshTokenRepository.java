package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RefreshToken entities.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    /**
     * Revoke a live token as part of rotation.
     *
     * @return true if this call revoked it, false if it was already revoked
     */
    boolean revokeForRotation(String tokenHash, String replacedBy, Instant now);

    int revokeTokenFamily(String tokenFamily, Instant now);

    int revokeByAuthorizationCode(String authorizationCodeId, Instant now);

    long deleteExpired(Instant now);
}
