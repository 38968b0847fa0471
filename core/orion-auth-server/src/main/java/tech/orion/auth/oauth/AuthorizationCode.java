package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Set;

/**
 * An authorization code issued by the authorization endpoint.
 *
 * Codes are:
 * - Short-lived (at most 60 seconds)
 * - Single-use (consumed by a conditional update at exchange)
 * - Bound to client, user, redirect URI, scope and PKCE challenge
 *
 * Only the SHA-256 hash of the code is stored.
 */
public class AuthorizationCode {

    public String id;

    /**
     * SHA-256 hash of the code handed to the client.
     */
    public String codeHash;

    public String clientId;

    public String userId;

    /**
     * Must match exactly during token exchange.
     */
    public String redirectUri;

    /**
     * Normalized scope string.
     */
    public String scope;

    public String codeChallenge;

    public String codeChallengeMethod;

    /**
     * OIDC nonce, echoed into the ID token.
     */
    public String nonce;

    public String state;

    /**
     * When the user authenticated, echoed as auth_time.
     */
    public Instant authTime;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean consumed = false;

    public Instant consumedAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Set<String> scopes() {
        return Scopes.parse(scope);
    }
}
