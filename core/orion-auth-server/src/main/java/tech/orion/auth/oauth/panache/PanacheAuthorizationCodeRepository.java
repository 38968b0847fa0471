package tech.orion.auth.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.oauth.AuthorizationCode;
import tech.orion.auth.oauth.AuthorizationCodeRepository;
import tech.orion.auth.oauth.entity.AuthorizationCodeEntity;
import tech.orion.auth.oauth.mapper.AuthorizationCodeMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCodeHash(String codeHash) {
        return find("codeHash", codeHash)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    public void persist(AuthorizationCode authCode) {
        persist(AuthorizationCodeMapper.toEntity(authCode));
    }

    @Override
    public boolean markConsumed(String codeHash, Instant now) {
        return update("consumed = true, consumedAt = ?1 where codeHash = ?2 and consumed = false and expiresAt > ?1",
            now, codeHash) == 1;
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
