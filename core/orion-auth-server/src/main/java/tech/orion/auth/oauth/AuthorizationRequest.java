package tech.orion.auth.oauth;

/**
 * Parameters of a {@code GET /oauth/authorize} request, as received.
 */
public record AuthorizationRequest(
        String responseType,
        String clientId,
        String redirectUri,
        String scope,
        String state,
        String codeChallenge,
        String codeChallengeMethod,
        String nonce
) {
}
