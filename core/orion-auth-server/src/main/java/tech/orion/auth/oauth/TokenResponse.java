package tech.orion.auth.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Successful token endpoint response (RFC 6749 section 5.1).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String access_token,
        String token_type,
        long expires_in,
        String refresh_token,
        String scope,
        String id_token
) {
}
