package tech.orion.auth.oauth.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for OAuth clients.
 */
@Entity
@Table(name = "oauth_clients")
public class OAuthClientEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 100)
    public String clientId;

    @Column(name = "client_secret_hash", length = 200)
    public String clientSecretHash;

    @Column(name = "name", nullable = false, length = 200)
    public String name;

    @Column(name = "description", length = 1000)
    public String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_redirect_uris", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @OrderColumn(name = "position")
    @Column(name = "redirect_uri", length = 2000)
    public List<String> redirectUris = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_grant_types", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @OrderColumn(name = "position")
    @Column(name = "grant_type", length = 50)
    public List<String> grantTypes = new ArrayList<>();

    @Column(name = "pkce_required", nullable = false)
    public boolean pkceRequired = true;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public OAuthClientEntity() {
    }
}
