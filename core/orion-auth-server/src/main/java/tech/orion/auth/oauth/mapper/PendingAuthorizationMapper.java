package tech.orion.auth.oauth.mapper;

import tech.orion.auth.oauth.PendingAuthorization;
import tech.orion.auth.oauth.entity.PendingAuthorizationEntity;

/**
 * Mapper for converting between PendingAuthorization domain and JPA entity.
 */
public final class PendingAuthorizationMapper {

    private PendingAuthorizationMapper() {
    }

    public static PendingAuthorization toDomain(PendingAuthorizationEntity entity) {
        if (entity == null) {
            return null;
        }

        PendingAuthorization domain = new PendingAuthorization();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.clientId = entity.clientId;
        domain.redirectUri = entity.redirectUri;
        domain.scope = entity.scope;
        domain.state = entity.state;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.nonce = entity.nonce;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static PendingAuthorizationEntity toEntity(PendingAuthorization domain) {
        if (domain == null) {
            return null;
        }

        PendingAuthorizationEntity entity = new PendingAuthorizationEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.clientId = domain.clientId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = domain.scope;
        entity.state = domain.state;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.nonce = domain.nonce;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
