package tech.orion.auth.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.oauth.OAuthClient;
import tech.orion.auth.oauth.OAuthClientRepository;
import tech.orion.auth.oauth.entity.OAuthClientEntity;
import tech.orion.auth.oauth.mapper.OAuthClientMapper;

import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    public boolean existsByClientId(String clientId) {
        return count("clientId", clientId) > 0;
    }

    @Override
    public void persist(OAuthClient client) {
        persist(OAuthClientMapper.toEntity(client));
    }

    @Override
    public void update(OAuthClient client) {
        find("clientId", client.clientId)
            .firstResultOptional()
            .ifPresent(entity -> OAuthClientMapper.updateEntity(entity, client));
    }
}
