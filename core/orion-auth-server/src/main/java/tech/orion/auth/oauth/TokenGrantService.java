package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.orion.auth.authentication.AuthConfig;
import tech.orion.auth.authentication.TokenService;
import tech.orion.auth.user.UserProfile;
import tech.orion.auth.user.UserProfileRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * The token endpoint's grant handling: authorization code exchange and refresh token rotation.
 *
 * <p>Each exchange runs in one transaction, so consuming a code (or revoking a refresh
 * token) commits together with the tokens it produces. Protocol failures do not roll
 * back: revocations triggered by a detected replay must stick even though the request
 * itself fails with {@code invalid_grant}.
 */
@ApplicationScoped
public class TokenGrantService {

    private static final Logger LOG = Logger.getLogger(TokenGrantService.class);
    private static final String TOKEN_TYPE = "Bearer";

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    PkceService pkceService;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    UserProfileRepository userProfileRepository;

    @Inject
    TokenService tokenService;

    @Inject
    AuthConfig config;

    @Inject
    Clock clock;

    @Transactional(dontRollbackOn = OAuthException.class)
    public TokenResponse exchange(TokenGrant grant) {
        if (grant instanceof TokenGrant.AuthorizationCodeGrant codeGrant) {
            return exchangeAuthorizationCode(codeGrant);
        }
        if (grant instanceof TokenGrant.RefreshTokenGrant refreshGrant) {
            return refresh(refreshGrant);
        }
        throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE, "Unsupported grant");
    }

    private TokenResponse exchangeAuthorizationCode(TokenGrant.AuthorizationCodeGrant grant) {
        OAuthClient client = clientRegistry.authenticate(grant.credentials());
        if (!client.isGrantTypeAllowed(OAuthClient.GRANT_AUTHORIZATION_CODE)) {
            throw new OAuthException(OAuthError.UNAUTHORIZED_CLIENT,
                    "Client is not allowed to use the authorization code grant");
        }

        Instant now = clock.instant();
        String codeHash = SecureTokens.hash(grant.code());
        AuthorizationCode authCode = codeRepository.findByCodeHash(codeHash)
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_GRANT, "Invalid authorization code"));

        if (authCode.consumed) {
            onCodeReplay(authCode, now);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code already used");
        }
        if (authCode.isExpired(now)) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code expired");
        }
        if (!authCode.redirectUri.equals(grant.redirectUri())) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "redirect_uri mismatch");
        }
        if (!authCode.clientId.equals(client.clientId)) {
            LOG.warnf("Client %s presented an authorization code issued to %s", client.clientId, authCode.clientId);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code was issued to another client");
        }
        verifyPkce(client, authCode, grant.codeVerifier());

        // Single use. Losing this race means another request redeemed the code first.
        if (!codeRepository.markConsumed(codeHash, now)) {
            // Also false when the code expired (or was swept) after it was read
            if (authCode.isExpired(clock.instant())) {
                throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code expired");
            }
            onCodeReplay(authCode, now);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code already used");
        }

        Set<String> scopes = authCode.scopes();
        String accessToken = tokenService.issueAccessToken(authCode.userId, client.clientId, authCode.scope);

        String refreshToken = null;
        if (client.isGrantTypeAllowed(OAuthClient.GRANT_REFRESH_TOKEN)) {
            refreshToken = issueRefreshToken(authCode.userId, client.clientId, authCode.scope,
                    UUID.randomUUID().toString(), authCode.id, now);
        }

        String idToken = null;
        if (scopes.contains(Scopes.OPENID)) {
            UserProfile profile = userProfileRepository.findByUserId(authCode.userId).orElse(null);
            idToken = tokenService.issueIdToken(authCode.userId, profile, client.clientId, scopes,
                    authCode.nonce, authCode.authTime);
        }

        LOG.infof("Authorization code exchanged for client %s, user %s", client.clientId, authCode.userId);
        return new TokenResponse(accessToken, TOKEN_TYPE, config.jwt().accessTokenExpiry().toSeconds(),
                refreshToken, authCode.scope, idToken);
    }

    private void verifyPkce(OAuthClient client, AuthorizationCode authCode, String codeVerifier) {
        if (authCode.codeChallenge == null) {
            if (client.requiresPkce()) {
                throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code has no PKCE challenge");
            }
            return;
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "code_verifier is required");
        }
        if (!pkceService.verify(codeVerifier, authCode.codeChallenge, authCode.codeChallengeMethod)) {
            LOG.warnf("PKCE verification failed for client %s", client.clientId);
            throw new OAuthException(OAuthError.INVALID_GRANT, "PKCE verification failed");
        }
    }

    private void onCodeReplay(AuthorizationCode authCode, Instant now) {
        int revoked = refreshTokenRepository.revokeByAuthorizationCode(authCode.id, now);
        LOG.warnf("SECURITY: authorization code %s replayed (client %s, user %s); revoked %d refresh tokens",
                authCode.id, authCode.clientId, authCode.userId, revoked);
    }

    private TokenResponse refresh(TokenGrant.RefreshTokenGrant grant) {
        OAuthClient client = clientRegistry.authenticate(grant.credentials());
        if (!client.isGrantTypeAllowed(OAuthClient.GRANT_REFRESH_TOKEN)) {
            throw new OAuthException(OAuthError.UNAUTHORIZED_CLIENT,
                    "Client is not allowed to use the refresh token grant");
        }

        Instant now = clock.instant();
        String tokenHash = SecureTokens.hash(grant.refreshToken());
        RefreshToken token = refreshTokenRepository.findByTokenHash(tokenHash)
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_GRANT, "Invalid refresh token"));

        if (token.revoked) {
            onRefreshReuse(token, now);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token has been revoked");
        }
        if (token.isExpired(now)) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token expired");
        }
        if (!token.clientId.equals(client.clientId)) {
            LOG.warnf("Client %s presented a refresh token issued to %s", client.clientId, token.clientId);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token was issued to another client");
        }

        String accessScope = token.scope;
        if (grant.scope() != null) {
            Set<String> requested = Scopes.parse(grant.scope());
            if (!token.scopes().containsAll(requested)) {
                throw new OAuthException(OAuthError.INVALID_SCOPE, "Requested scope exceeds the original grant");
            }
            accessScope = Scopes.format(requested);
        }

        String newToken = SecureTokens.generate();
        String newHash = SecureTokens.hash(newToken);
        if (!refreshTokenRepository.revokeForRotation(tokenHash, newHash, now)) {
            // Another request rotated this token between our read and our update
            onRefreshReuse(token, now);
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token has been revoked");
        }
        persistRefreshToken(newHash, token.userId, client.clientId, token.scope, token.tokenFamily,
                tokenHash, token.authorizationCodeId, now);

        String accessToken = tokenService.issueAccessToken(token.userId, client.clientId, accessScope);
        LOG.debugf("Refresh token rotated for client %s, family %s", client.clientId, token.tokenFamily);
        return new TokenResponse(accessToken, TOKEN_TYPE, config.jwt().accessTokenExpiry().toSeconds(),
                newToken, accessScope, null);
    }

    private void onRefreshReuse(RefreshToken token, Instant now) {
        int revoked = refreshTokenRepository.revokeTokenFamily(token.tokenFamily, now);
        LOG.warnf("SECURITY: revoked refresh token reused (client %s, user %s, family %s); revoked %d tokens",
                token.clientId, token.userId, token.tokenFamily, revoked);
    }

    /**
     * First token of a new family.
     */
    private String issueRefreshToken(String userId, String clientId, String scope, String family,
                                     String authorizationCodeId, Instant now) {
        String token = SecureTokens.generate();
        persistRefreshToken(SecureTokens.hash(token), userId, clientId, scope, family, null,
                authorizationCodeId, now);
        return token;
    }

    private void persistRefreshToken(String tokenHash, String userId, String clientId, String scope, String family,
                                     String rotatedFrom, String authorizationCodeId, Instant now) {
        RefreshToken refreshToken = new RefreshToken();
        refreshToken.tokenHash = tokenHash;
        refreshToken.userId = userId;
        refreshToken.clientId = clientId;
        refreshToken.scope = scope;
        refreshToken.tokenFamily = family;
        refreshToken.rotatedFrom = rotatedFrom;
        refreshToken.authorizationCodeId = authorizationCodeId;
        refreshToken.createdAt = now;
        refreshToken.expiresAt = now.plus(config.jwt().refreshTokenExpiry());
        refreshToken.revoked = false;
        refreshTokenRepository.persist(refreshToken);
    }
}
