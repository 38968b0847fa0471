package tech.orion.auth.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.oauth.RefreshToken;
import tech.orion.auth.oauth.RefreshTokenRepository;
import tech.orion.auth.oauth.entity.RefreshTokenEntity;
import tech.orion.auth.oauth.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public void persist(RefreshToken token) {
        persist(RefreshTokenMapper.toEntity(token));
    }

    @Override
    public boolean revokeForRotation(String tokenHash, String replacedBy, Instant now) {
        return update("revoked = true, revokedAt = ?1, replacedBy = ?2 where tokenHash = ?3 and revoked = false",
            now, replacedBy, tokenHash) == 1;
    }

    @Override
    public int revokeTokenFamily(String tokenFamily, Instant now) {
        return update("revoked = true, revokedAt = ?1 where tokenFamily = ?2 and revoked = false",
            now, tokenFamily);
    }

    @Override
    public int revokeByAuthorizationCode(String authorizationCodeId, Instant now) {
        return update("revoked = true, revokedAt = ?1 where authorizationCodeId = ?2 and revoked = false",
            now, authorizationCodeId);
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
