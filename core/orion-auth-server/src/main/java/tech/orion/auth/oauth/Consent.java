package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scopes a user has approved for a client. One record per (user, client).
 */
public class Consent {

    public String id;

    public String userId;

    public String clientId;

    public Set<String> grantedScopes = new TreeSet<>();

    public Instant grantedAt;

    public Instant updatedAt;

    public boolean covers(Set<String> requestedScopes) {
        return grantedScopes.containsAll(requestedScopes);
    }
}
