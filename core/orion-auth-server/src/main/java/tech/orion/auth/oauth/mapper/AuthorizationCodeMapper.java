package tech.orion.auth.oauth.mapper;

import tech.orion.auth.oauth.AuthorizationCode;
import tech.orion.auth.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain and JPA entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.codeHash = entity.codeHash;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.redirectUri = entity.redirectUri;
        domain.scope = entity.scope;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.nonce = entity.nonce;
        domain.state = entity.state;
        domain.authTime = entity.authTime;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.consumed = entity.consumed;
        domain.consumedAt = entity.consumedAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.codeHash = domain.codeHash;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = domain.scope;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.nonce = domain.nonce;
        entity.state = domain.state;
        entity.authTime = domain.authTime;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.consumed = domain.consumed;
        entity.consumedAt = domain.consumedAt;
        return entity;
    }
}
