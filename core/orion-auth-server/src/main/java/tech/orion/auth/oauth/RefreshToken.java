package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.Set;

/**
 * An opaque refresh token.
 *
 * Features:
 * - Rotation: each use revokes the token and issues a new one
 * - Family tracking: every token of one rotation chain shares {@code tokenFamily};
 *   presenting a revoked member revokes the whole family
 * - Code binding: {@code authorizationCodeId} names the code that started the family,
 *   so a replayed code can revoke what it produced
 *
 * Security: only the token hash is stored, not the actual token.
 */
public class RefreshToken {

    /**
     * SHA-256 hash of the refresh token.
     */
    public String tokenHash;

    public String userId;

    public String clientId;

    /**
     * Normalized scope granted to the family.
     */
    public String scope;

    public String tokenFamily;

    /**
     * Hash of the token this one replaced, null for the first of a family.
     */
    public String rotatedFrom;

    public String authorizationCodeId;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean revoked = false;

    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one.
     */
    public String replacedBy;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Set<String> scopes() {
        return Scopes.parse(scope);
    }
}
