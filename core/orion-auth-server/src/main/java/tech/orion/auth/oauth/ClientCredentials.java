package tech.orion.auth.oauth;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Client credentials presented at the token endpoint, merged from the HTTP Basic
 * header ({@code client_secret_basic}) and the form body ({@code client_secret_post}
 * or, for public clients, {@code none}).
 *
 * @param clientSecret null when no secret was presented
 */
public record ClientCredentials(String clientId, String clientSecret) {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * Merge header and body credentials. Sending the same value in both places is
     * accepted; sending different values is {@code invalid_request}.
     *
     * @throws OAuthException invalid_request on a malformed Basic header,
     *                        conflicting values or a missing client id
     */
    public static ClientCredentials resolve(String authorizationHeader, String formClientId, String formClientSecret) {
        String basicId = null;
        String basicSecret = null;
        if (authorizationHeader != null && authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            String[] parts = parseBasicAuth(authorizationHeader.substring(BASIC_PREFIX.length()).trim());
            basicId = parts[0];
            basicSecret = parts[1];
        }

        String clientId = merge("client_id", basicId, blankToNull(formClientId));
        String clientSecret = merge("client_secret", basicSecret, blankToNull(formClientSecret));
        if (clientId == null) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "client_id is required");
        }
        return new ClientCredentials(clientId, clientSecret);
    }

    /**
     * Per RFC 6749 section 2.3.1 both halves are form-urlencoded before joining.
     */
    private static String[] parseBasicAuth(String encoded) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Malformed Basic authorization header");
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Malformed Basic authorization header");
        }
        try {
            String id = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
            String secret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);
            return new String[]{blankToNull(id), blankToNull(secret)};
        } catch (IllegalArgumentException e) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Malformed Basic authorization header");
        }
    }

    private static String merge(String name, String fromHeader, String fromBody) {
        if (fromHeader != null && fromBody != null && !fromHeader.equals(fromBody)) {
            throw new OAuthException(OAuthError.INVALID_REQUEST,
                    name + " in the Authorization header and the request body do not match");
        }
        return fromHeader != null ? fromHeader : fromBody;
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
