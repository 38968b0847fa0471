package tech.orion.auth.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.oauth.PendingAuthorization;
import tech.orion.auth.oauth.PendingAuthorizationRepository;
import tech.orion.auth.oauth.entity.PendingAuthorizationEntity;
import tech.orion.auth.oauth.mapper.PendingAuthorizationMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of PendingAuthorizationRepository.
 */
@ApplicationScoped
public class PanachePendingAuthorizationRepository
    implements PendingAuthorizationRepository, PanacheRepositoryBase<PendingAuthorizationEntity, String> {

    @Override
    public Optional<PendingAuthorization> findPending(String id) {
        return find("id", id)
            .firstResultOptional()
            .map(PendingAuthorizationMapper::toDomain);
    }

    @Override
    public void persist(PendingAuthorization pending) {
        persist(PendingAuthorizationMapper.toEntity(pending));
    }

    @Override
    public boolean consume(String id) {
        return delete("id = ?1", id) == 1;
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
