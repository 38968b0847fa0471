package tech.orion.auth.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration for the Orion authorization server.
 *
 * Example configuration:
 * <pre>
 * orion.auth.jwt.issuer=https://auth.example.com
 * orion.auth.jwt.private-key-path=/keys/private.pem
 * orion.auth.jwt.public-key-path=/keys/public.pem
 * orion.auth.jwt.previous-public-key-path=/keys/previous-public.pem
 *
 * orion.auth.bootstrap-clients[0].client-id=public_test_client_001
 * orion.auth.bootstrap-clients[0].name=Test SPA
 * orion.auth.bootstrap-clients[0].redirect-uris=http://localhost:3000/callback
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "orion.auth")
public interface AuthConfig {

    /**
     * JWT configuration for token issuance and validation.
     */
    JwtConfig jwt();

    /**
     * Session cookie configuration.
     */
    SessionConfig session();

    /**
     * Where unauthenticated users are sent. The original authorize URL is
     * appended as the {@code returnUrl} query parameter.
     */
    @WithName("login-url")
    @WithDefault("/auth")
    String loginUrl();

    /**
     * Consent UI. Receives the pending request id as {@code request_id}.
     */
    @WithName("consent-url")
    @WithDefault("/oauth/consent")
    String consentUrl();

    /**
     * How long a request parked for consent stays usable.
     */
    @WithName("pending-request-expiry")
    @WithDefault("PT10M")
    Duration pendingRequestExpiry();

    @WithName("supported-scopes")
    @WithDefault("openid,profile,email,roles,offline_access")
    Set<String> supportedScopes();

    /**
     * How often expired codes, pending requests and refresh tokens are deleted.
     * Read by the scheduler as {@code ${orion.auth.sweep-interval}}.
     */
    @WithName("sweep-interval")
    @WithDefault("15m")
    String sweepInterval();

    /**
     * Public base URL used in discovery metadata. Falls back to the request URL.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * Clients registered at startup when they do not exist yet.
     */
    @WithName("bootstrap-clients")
    Optional<List<BootstrapClient>> bootstrapClients();

    /**
     * JWT configuration.
     */
    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         */
        @WithDefault("orion")
        String issuer();

        /**
         * RSA private key for signing tokens (PEM format).
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * RSA public key matching the private key (PEM format).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Public key of the key pair that was active before the last rotation.
         * Tokens signed with it keep verifying until they expire.
         */
        @WithName("previous-public-key-path")
        Optional<String> previousPublicKeyPath();

        /**
         * Directory for generated keys when no key paths are configured.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        @WithName("id-token-expiry")
        @WithDefault("PT1H")
        Duration idTokenExpiry();

        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        /**
         * Authorization code lifetime. Values above 60 seconds are clamped.
         */
        @WithName("authorization-code-expiry")
        @WithDefault("PT60S")
        Duration authorizationCodeExpiry();
    }

    /**
     * Session cookie configuration.
     */
    interface SessionConfig {
        @WithName("cookie-name")
        @WithDefault("orion_session")
        String cookieName();

        @WithName("token-expiry")
        @WithDefault("PT8H")
        Duration tokenExpiry();
    }

    /**
     * A client seeded at startup.
     */
    interface BootstrapClient {
        @WithName("client-id")
        String clientId();

        String name();

        Optional<String> description();

        /**
         * Plaintext secret, hashed before it is stored. Absent for public clients.
         */
        Optional<String> secret();

        @WithName("redirect-uris")
        List<String> redirectUris();

        @WithName("grant-types")
        @WithDefault("authorization_code,refresh_token")
        List<String> grantTypes();

        /**
         * Only confidential clients may set this to false.
         */
        @WithName("pkce-required")
        Optional<Boolean> pkceRequired();
    }
}
