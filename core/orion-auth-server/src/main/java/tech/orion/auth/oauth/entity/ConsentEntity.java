package tech.orion.auth.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for oauth_consents table.
 */
@Entity
@Table(name = "oauth_consents", uniqueConstraints = {
        @UniqueConstraint(name = "uk_oauth_consents_user_client", columnNames = {"user_id", "client_id"})
})
public class ConsentEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    /**
     * Normalized, space-separated.
     */
    @Column(name = "granted_scopes", nullable = false, length = 1000)
    public String grantedScopes;

    @Column(name = "granted_at", nullable = false)
    public Instant grantedAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public ConsentEntity() {
    }
}
