package tech.orion.auth.oauth.mapper;

import tech.orion.auth.oauth.Consent;
import tech.orion.auth.oauth.Scopes;
import tech.orion.auth.oauth.entity.ConsentEntity;

import java.util.TreeSet;

/**
 * Mapper for converting between Consent domain and JPA entity.
 * Granted scopes are stored as one normalized string.
 */
public final class ConsentMapper {

    private ConsentMapper() {
    }

    public static Consent toDomain(ConsentEntity entity) {
        if (entity == null) {
            return null;
        }

        Consent domain = new Consent();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.clientId = entity.clientId;
        domain.grantedScopes = new TreeSet<>(Scopes.parse(entity.grantedScopes));
        domain.grantedAt = entity.grantedAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static ConsentEntity toEntity(Consent domain) {
        if (domain == null) {
            return null;
        }

        ConsentEntity entity = new ConsentEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.clientId = domain.clientId;
        entity.grantedAt = domain.grantedAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(ConsentEntity entity, Consent domain) {
        entity.grantedScopes = Scopes.format(domain.grantedScopes);
        entity.updatedAt = domain.updatedAt;
    }
}
