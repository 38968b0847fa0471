package tech.orion.auth.oauth;

import jakarta.ws.rs.core.MultivaluedMap;

import java.util.List;
import java.util.Map;

/**
 * A token endpoint request, parsed and validated at the boundary into one shape per grant type.
 */
public sealed interface TokenGrant {

    ClientCredentials credentials();

    record AuthorizationCodeGrant(ClientCredentials credentials, String code, String redirectUri,
                                  String codeVerifier) implements TokenGrant {
    }

    /**
     * @param scope requested narrowing, null to keep the granted scope
     */
    record RefreshTokenGrant(ClientCredentials credentials, String refreshToken,
                             String scope) implements TokenGrant {
    }

    /**
     * Parse a form-encoded token request.
     *
     * @throws OAuthException invalid_request for missing or repeated parameters,
     *                        unsupported_grant_type for anything but the two supported grants
     */
    static TokenGrant parse(MultivaluedMap<String, String> form, String authorizationHeader) {
        for (Map.Entry<String, List<String>> param : form.entrySet()) {
            if (param.getValue() != null && param.getValue().size() > 1) {
                throw new OAuthException(OAuthError.INVALID_REQUEST, "Parameter repeated: " + param.getKey());
            }
        }

        String grantType = form.getFirst("grant_type");
        if (grantType == null || grantType.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "grant_type is required");
        }

        if (OAuthClient.GRANT_AUTHORIZATION_CODE.equals(grantType)) {
            ClientCredentials credentials = credentials(form, authorizationHeader);
            return new AuthorizationCodeGrant(credentials,
                    required(form, "code"),
                    form.getFirst("redirect_uri"),
                    form.getFirst("code_verifier"));
        }
        if (OAuthClient.GRANT_REFRESH_TOKEN.equals(grantType)) {
            ClientCredentials credentials = credentials(form, authorizationHeader);
            String scope = form.getFirst("scope");
            return new RefreshTokenGrant(credentials,
                    required(form, "refresh_token"),
                    scope == null || scope.isBlank() ? null : scope);
        }
        throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE, "Unsupported grant_type: " + grantType);
    }

    private static ClientCredentials credentials(MultivaluedMap<String, String> form, String authorizationHeader) {
        return ClientCredentials.resolve(authorizationHeader, form.getFirst("client_id"), form.getFirst("client_secret"));
    }

    private static String required(MultivaluedMap<String, String> form, String name) {
        String value = form.getFirst(name);
        if (value == null || value.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, name + " is required");
        }
        return value;
    }
}
