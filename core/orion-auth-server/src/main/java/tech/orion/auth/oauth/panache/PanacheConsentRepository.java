package tech.orion.auth.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.oauth.Consent;
import tech.orion.auth.oauth.ConsentRepository;
import tech.orion.auth.oauth.entity.ConsentEntity;
import tech.orion.auth.oauth.mapper.ConsentMapper;

import java.util.Optional;

/**
 * Panache-based implementation of ConsentRepository.
 */
@ApplicationScoped
public class PanacheConsentRepository
    implements ConsentRepository, PanacheRepositoryBase<ConsentEntity, String> {

    @Override
    public Optional<Consent> findByUserAndClient(String userId, String clientId) {
        return find("userId = ?1 and clientId = ?2", userId, clientId)
            .firstResultOptional()
            .map(ConsentMapper::toDomain);
    }

    @Override
    public void persist(Consent consent) {
        persist(ConsentMapper.toEntity(consent));
    }

    @Override
    public void update(Consent consent) {
        ConsentEntity entity = findById(consent.id);
        if (entity != null) {
            ConsentMapper.updateEntity(entity, consent);
        }
    }
}
