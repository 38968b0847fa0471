package tech.orion.auth.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered OAuth client.
 *
 * <p>Two kinds of client:
 * <ul>
 *   <li>Public: SPAs and native apps. No secret, PKCE always required.</li>
 *   <li>Confidential: server-side apps. Authenticate with a secret stored as an Argon2id hash.</li>
 * </ul>
 */
public class OAuthClient {

    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";
    public static final List<String> SUPPORTED_GRANT_TYPES = List.of(GRANT_AUTHORIZATION_CODE, GRANT_REFRESH_TOKEN);

    public String id;

    /**
     * Identifier used in OAuth flows. Never changes once registered.
     */
    public String clientId;

    /**
     * Argon2id hash of the client secret. Null for public clients.
     */
    public String clientSecretHash;

    /**
     * Shown on the consent screen.
     */
    public String name;

    public String description;

    /**
     * Must match the requested redirect_uri exactly, character for character.
     */
    public List<String> redirectUris = new ArrayList<>();

    /**
     * Forced on for public clients.
     */
    public boolean pkceRequired = true;

    public List<String> allowedGrantTypes = new ArrayList<>();

    public boolean active = true;

    public Instant createdAt;

    public Instant updatedAt;

    public OAuthClient() {
    }

    public boolean isRedirectUriAllowed(String uri) {
        if (redirectUris == null || uri == null) {
            return false;
        }
        return redirectUris.contains(uri);
    }

    public boolean isGrantTypeAllowed(String grantType) {
        if (allowedGrantTypes == null || grantType == null) {
            return false;
        }
        return allowedGrantTypes.contains(grantType);
    }

    public boolean isPublic() {
        return clientSecretHash == null;
    }

    public boolean isConfidential() {
        return clientSecretHash != null;
    }

    public boolean requiresPkce() {
        return pkceRequired || isPublic();
    }
}
