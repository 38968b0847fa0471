package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.orion.auth.shared.EntityType;
import tech.orion.auth.shared.TsidGenerator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registered clients: lookup, authentication and the admin operations that create
 * clients and rotate their secrets.
 */
@ApplicationScoped
public class ClientRegistry {

    private static final Logger LOG = Logger.getLogger(ClientRegistry.class);

    @Inject
    OAuthClientRepository clientRepository;

    @Inject
    ClientSecretService secretService;

    @Inject
    Clock clock;

    /**
     * What an administrator supplies to register a client.
     *
     * @param clientId     null to generate one
     * @param confidential whether the client gets a secret
     * @param secret       preset plaintext secret for a confidential client, null to generate one
     * @param pkceRequired null means required; only confidential clients may pass false
     */
    public record Registration(String clientId, String name, String description, List<String> redirectUris,
                               List<String> grantTypes, boolean confidential, String secret, Boolean pkceRequired) {
    }

    /**
     * @param plaintextSecret shown once, null for public clients
     */
    public record RegisteredClient(OAuthClient client, String plaintextSecret) {
    }

    /**
     * Active clients only. Inactive clients are indistinguishable from unknown ones.
     */
    public Optional<OAuthClient> lookup(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return clientRepository.findByClientId(clientId).filter(client -> client.active);
    }

    /**
     * Authenticate a client at the token endpoint.
     *
     * Public clients authenticate by id alone; any secret they send is ignored.
     * Confidential clients must present their secret.
     *
     * @throws OAuthException invalid_client on unknown client or bad secret
     */
    public OAuthClient authenticate(ClientCredentials credentials) {
        Optional<OAuthClient> found = lookup(credentials.clientId());
        if (found.isEmpty()) {
            LOG.warnf("Client authentication failed: unknown client %s", credentials.clientId());
            throw new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication failed");
        }

        OAuthClient client = found.get();
        if (client.isConfidential()) {
            if (credentials.clientSecret() == null) {
                LOG.warnf("Client authentication failed: no secret presented by %s", client.clientId);
                throw new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication required");
            }
            if (!secretService.verifySecret(credentials.clientSecret(), client.clientSecretHash)) {
                LOG.warnf("Client authentication failed: bad secret for %s", client.clientId);
                throw new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication failed");
            }
        }
        return client;
    }

    /**
     * Exact string comparison. No normalization, prefix or wildcard matching.
     */
    public boolean isRedirectUriRegistered(OAuthClient client, String redirectUri) {
        return client.isRedirectUriAllowed(redirectUri);
    }

    /**
     * Register a new client.
     *
     * @throws IllegalArgumentException if the registration is invalid or the client id is taken
     */
    @Transactional
    public RegisteredClient register(Registration registration) {
        if (registration.name() == null || registration.name().isBlank()) {
            throw new IllegalArgumentException("Client name is required");
        }
        List<String> redirectUris = registration.redirectUris() != null ? registration.redirectUris() : List.of();
        if (redirectUris.isEmpty()) {
            throw new IllegalArgumentException("At least one redirect URI is required");
        }
        redirectUris.forEach(ClientRegistry::validateRedirectUri);

        List<String> grantTypes = registration.grantTypes() != null && !registration.grantTypes().isEmpty()
                ? registration.grantTypes()
                : OAuthClient.SUPPORTED_GRANT_TYPES;
        for (String grantType : grantTypes) {
            if (!OAuthClient.SUPPORTED_GRANT_TYPES.contains(grantType)) {
                throw new IllegalArgumentException("Unsupported grant type: " + grantType);
            }
        }

        boolean pkceRequired = registration.pkceRequired() == null || registration.pkceRequired();
        if (!pkceRequired && !registration.confidential()) {
            throw new IllegalArgumentException("Public clients cannot opt out of PKCE");
        }

        String clientId = registration.clientId() != null
                ? registration.clientId()
                : TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        if (clientRepository.existsByClientId(clientId)) {
            throw new IllegalArgumentException("Client already registered: " + clientId);
        }

        String plaintextSecret = null;
        OAuthClient client = new OAuthClient();
        client.id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        client.clientId = clientId;
        client.name = registration.name();
        client.description = registration.description();
        client.redirectUris = new ArrayList<>(redirectUris);
        client.allowedGrantTypes = new ArrayList<>(grantTypes);
        if (registration.confidential()) {
            plaintextSecret = registration.secret() != null ? registration.secret() : secretService.generateSecret();
            client.clientSecretHash = secretService.hashSecret(plaintextSecret);
        }
        client.pkceRequired = pkceRequired;
        client.active = true;
        Instant now = clock.instant();
        client.createdAt = now;
        client.updatedAt = now;

        clientRepository.persist(client);
        LOG.infof("Registered %s client %s (%s)",
                client.isConfidential() ? "confidential" : "public", client.clientId, client.name);
        return new RegisteredClient(client, plaintextSecret);
    }

    /**
     * Replace a confidential client's secret.
     *
     * @return the new plaintext secret, shown once
     * @throws IllegalArgumentException if the client is unknown or public
     */
    @Transactional
    public String rotateSecret(String clientId) {
        OAuthClient client = lookup(clientId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown client: " + clientId));
        if (client.isPublic()) {
            throw new IllegalArgumentException("Public clients have no secret: " + clientId);
        }
        String secret = secretService.generateSecret();
        client.clientSecretHash = secretService.hashSecret(secret);
        client.updatedAt = clock.instant();
        clientRepository.update(client);
        LOG.infof("Rotated secret for client %s", clientId);
        return secret;
    }

    private static void validateRedirectUri(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("Redirect URI cannot be blank");
        }
        try {
            URI uri = new URI(redirectUri);
            if (!uri.isAbsolute()) {
                throw new IllegalArgumentException("Redirect URI must be absolute: " + redirectUri);
            }
            if (uri.getRawFragment() != null) {
                throw new IllegalArgumentException("Redirect URI must not contain a fragment: " + redirectUri);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid redirect URI: " + redirectUri, e);
        }
    }
}
