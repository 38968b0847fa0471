package tech.orion.auth.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for pending_authorizations table.
 */
@Entity
@Table(name = "pending_authorizations", indexes = {
        @Index(name = "idx_pending_authorizations_expires_at", columnList = "expires_at")
})
public class PendingAuthorizationEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "redirect_uri", nullable = false, length = 2000)
    public String redirectUri;

    @Column(name = "scope", length = 500)
    public String scope;

    @Column(name = "state", length = 1000)
    public String state;

    @Column(name = "code_challenge", length = 128)
    public String codeChallenge;

    @Column(name = "code_challenge_method", length = 10)
    public String codeChallengeMethod;

    @Column(name = "nonce", length = 500)
    public String nonce;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public PendingAuthorizationEntity() {
    }
}
