package tech.orion.auth.oauth;

import java.util.Optional;

/**
 * Repository interface for OAuth clients.
 */
public interface OAuthClientRepository {

    // Read operations
    Optional<OAuthClient> findByClientId(String clientId);
    boolean existsByClientId(String clientId);

    // Write operations
    void persist(OAuthClient client);
    void update(OAuthClient client);
}
