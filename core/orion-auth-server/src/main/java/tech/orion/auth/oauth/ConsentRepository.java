package tech.orion.auth.oauth;

import java.util.Optional;

/**
 * Repository interface for Consent entities.
 */
public interface ConsentRepository {

    Optional<Consent> findByUserAndClient(String userId, String clientId);

    void persist(Consent consent);

    void update(Consent consent);
}
