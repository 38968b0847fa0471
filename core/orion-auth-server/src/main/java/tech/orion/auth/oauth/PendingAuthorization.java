package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Set;

/**
 * A validated authorization request parked while the user decides on consent.
 * The id is handed to the consent UI as {@code request_id}; everything else stays
 * server-side, so the consent decision cannot alter the original request.
 */
public class PendingAuthorization {

    public String id;

    public String userId;

    public String clientId;

    public String redirectUri;

    public String scope;

    public String state;

    public String codeChallenge;

    public String codeChallengeMethod;

    public String nonce;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Set<String> scopes() {
        return Scopes.parse(scope);
    }
}
