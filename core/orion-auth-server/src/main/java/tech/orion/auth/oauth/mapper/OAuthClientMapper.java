package tech.orion.auth.oauth.mapper;

import tech.orion.auth.oauth.OAuthClient;
import tech.orion.auth.oauth.entity.OAuthClientEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between OAuthClient domain and JPA entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.allowedGrantTypes = entity.grantTypes != null ? new ArrayList<>(entity.grantTypes) : new ArrayList<>();
        domain.pkceRequired = entity.pkceRequired;
        domain.active = entity.active;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    /**
     * Copy mutable fields. {@code clientId} never changes after registration.
     */
    public static void updateEntity(OAuthClientEntity entity, OAuthClient domain) {
        entity.clientSecretHash = domain.clientSecretHash;
        entity.name = domain.name;
        entity.description = domain.description;
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.grantTypes = domain.allowedGrantTypes != null ? new ArrayList<>(domain.allowedGrantTypes) : new ArrayList<>();
        entity.pkceRequired = domain.pkceRequired;
        entity.active = domain.active;
        entity.updatedAt = domain.updatedAt;
    }
}
