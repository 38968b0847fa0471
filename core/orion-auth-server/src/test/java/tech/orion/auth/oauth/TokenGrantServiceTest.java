package tech.orion.auth.oauth;

import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.orion.auth.authentication.Claims;
import tech.orion.auth.authentication.TokenService;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static tech.orion.auth.oauth.OAuthTestFixture.*;

@DisplayName("Token Grant Service Tests")
class TokenGrantServiceTest {

    @TempDir
    Path keyDir;

    private OAuthTestFixture fixture;
    private TokenGrantService service;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture(keyDir);
        service = fixture.tokenGrantService;
    }

    // ========================================
    // AUTHORIZATION CODE EXCHANGE
    // ========================================

    @Test
    @DisplayName("exchange should return access, refresh and ID tokens for a valid code")
    void exchange_shouldIssueTokens_whenCodeValid() {
        // Act
        TokenResponse response = fixture.exchangePublicCode("openid profile");

        // Assert
        assertThat(response.token_type()).isEqualTo("Bearer");
        assertThat(response.expires_in()).isEqualTo(3600);
        assertThat(response.scope()).isEqualTo("openid profile");
        assertThat(response.refresh_token()).isNotBlank();
        assertThat(response.id_token()).isNotBlank();

        JsonWebToken access = fixture.keys.verify(response.access_token(), PUBLIC_CLIENT).orElseThrow();
        assertThat(access.getSubject()).isEqualTo(USER_ID);
        assertThat(Claims.string(access, "scope")).isEqualTo("openid profile");
        assertThat(Claims.string(access, "client_id")).isEqualTo(PUBLIC_CLIENT);
        assertThat(Claims.string(access, TokenService.TOKEN_USE)).isEqualTo(TokenService.USE_ACCESS);
    }

    @Test
    @DisplayName("exchange should put nonce, auth_time and only granted profile claims in the ID token")
    void exchange_shouldScopeIdTokenClaims() {
        TokenResponse response = fixture.exchangePublicCode("openid profile");

        JsonWebToken idToken = fixture.keys.verify(response.id_token(), PUBLIC_CLIENT).orElseThrow();
        assertThat(idToken.getSubject()).isEqualTo(USER_ID);
        assertThat(Claims.string(idToken, "nonce")).isEqualTo("n-0S6_WzA2Mj");
        assertThat(Claims.string(idToken, "auth_time")).isNotNull();
        assertThat(Claims.string(idToken, "name")).isEqualTo("Alice Example");
        assertThat(idToken.containsClaim("email")).isFalse();
        assertThat(idToken.containsClaim("roles")).isFalse();
    }

    @Test
    @DisplayName("exchange should not issue an ID token without the openid scope")
    void exchange_shouldOmitIdToken_whenOpenidNotRequested() {
        TokenResponse response = fixture.exchangePublicCode("profile");

        assertThat(response.id_token()).isNull();
        assertThat(response.access_token()).isNotBlank();
    }

    @Test
    @DisplayName("exchange should authenticate a confidential client by secret")
    void exchange_shouldIssueTokens_whenConfidentialClientAuthenticated() {
        String code = fixture.issueCode(fixture.request(CONFIDENTIAL_CLIENT, CONFIDENTIAL_REDIRECT, "openid", "s"));

        TokenResponse response = service.exchange(new TokenGrant.AuthorizationCodeGrant(
            new ClientCredentials(CONFIDENTIAL_CLIENT, CONFIDENTIAL_SECRET), code, CONFIDENTIAL_REDIRECT, VERIFIER));

        assertThat(response.access_token()).isNotBlank();
    }

    @Test
    @DisplayName("exchange should reject a confidential client with a wrong secret")
    void exchange_shouldReject_whenSecretWrong() {
        String code = fixture.issueCode(fixture.request(CONFIDENTIAL_CLIENT, CONFIDENTIAL_REDIRECT, "openid", "s"));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(CONFIDENTIAL_CLIENT, "wrong"), code, CONFIDENTIAL_REDIRECT, VERIFIER)),
            OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("exchange should reject a second use of the same code and revoke its refresh tokens")
    void exchange_shouldRevokeIssuedTokens_whenCodeReplayed() {
        // Arrange
        String code = fixture.issueCode(fixture.publicRequest("openid"));
        TokenGrant.AuthorizationCodeGrant grant = new TokenGrant.AuthorizationCodeGrant(
            new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, VERIFIER);
        TokenResponse first = service.exchange(grant);

        // Act / Assert
        assertError(() -> service.exchange(grant), OAuthError.INVALID_GRANT);

        RefreshToken stored = fixture.refreshTokenRepository
            .findByTokenHash(SecureTokens.hash(first.refresh_token())).orElseThrow();
        assertThat(stored.revoked).isTrue();
        assertError(() -> service.exchange(fixture.publicRefresh(first.refresh_token(), null)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should let exactly one of two concurrent redemptions succeed")
    void exchange_shouldSucceedOnce_whenRedeemedConcurrently() throws Exception {
        String code = fixture.issueCode(fixture.publicRequest("openid"));
        TokenGrant.AuthorizationCodeGrant grant = new TokenGrant.AuthorizationCodeGrant(
            new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, VERIFIER);

        int attempts = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        service.exchange(grant);
                        return true;
                    } catch (OAuthException e) {
                        return false;
                    }
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("exchange should require the exact redirect URI used when authorizing")
    void exchange_shouldReject_whenRedirectUriDiffers() {
        String code = fixture.issueCode(fixture.publicRequest("openid"));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT + "/", VERIFIER)),
            OAuthError.INVALID_GRANT);
        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, null, VERIFIER)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should require a matching code verifier")
    void exchange_shouldReject_whenVerifierMissingOrWrong() {
        String code = fixture.issueCode(fixture.publicRequest("openid"));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, null)),
            OAuthError.INVALID_GRANT);
        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, "x".repeat(43))),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should reject a code presented by another client")
    void exchange_shouldReject_whenCodeIssuedToOtherClient() {
        String code = fixture.issueCode(fixture.request(CONFIDENTIAL_CLIENT, CONFIDENTIAL_REDIRECT, "openid", "s"));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, CONFIDENTIAL_REDIRECT, VERIFIER)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should reject an expired code")
    void exchange_shouldReject_whenCodeExpired() {
        String code = fixture.issueCode(fixture.publicRequest("openid"));
        fixture.clock.advance(Duration.ofSeconds(61));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, VERIFIER)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should report expiry, not replay, when the code is swept between read and consume")
    void exchange_shouldRejectAsExpired_whenCodeSweptBeforeConsume() {
        // Arrange
        String code = fixture.issueCode(fixture.publicRequest("openid"));
        InMemoryRepositories.Codes sweptMidway = new InMemoryRepositories.Codes() {
            @Override
            public synchronized boolean markConsumed(String codeHash, Instant now) {
                fixture.clock.advance(Duration.ofSeconds(61));
                fixture.codeRepository.deleteExpired(fixture.clock.instant());
                return fixture.codeRepository.markConsumed(codeHash, now);
            }

            @Override
            public synchronized Optional<AuthorizationCode> findByCodeHash(String codeHash) {
                return fixture.codeRepository.findByCodeHash(codeHash);
            }
        };
        service.codeRepository = sweptMidway;

        // Act / Assert
        assertThatThrownBy(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, VERIFIER)))
            .isInstanceOf(OAuthException.class)
            .satisfies(e -> {
                assertThat(((OAuthException) e).error()).isEqualTo(OAuthError.INVALID_GRANT);
                assertThat(((OAuthException) e).description()).isEqualTo("Authorization code expired");
            });
        assertThat(fixture.refreshTokenRepository.all()).isEmpty();
    }

    @Test
    @DisplayName("exchange should let a confidential client without PKCE redeem a code without a verifier")
    void exchange_shouldIssueTokens_whenConfidentialClientOptedOutOfPkce() {
        // Arrange
        fixture.clientRegistry.register(new ClientRegistry.Registration("legacy-backend", "Legacy backend", null,
            List.of("https://legacy.example.test/cb"), null, true, "legacy-secret-0123456789", false));
        AuthorizationRequest request = new AuthorizationRequest("code", "legacy-backend",
            "https://legacy.example.test/cb", "openid", "s", null, null, null);

        // Act
        String code = fixture.issueCode(request);
        TokenResponse response = service.exchange(new TokenGrant.AuthorizationCodeGrant(
            new ClientCredentials("legacy-backend", "legacy-secret-0123456789"), code,
            "https://legacy.example.test/cb", null));

        // Assert
        assertThat(code).isNotBlank();
        assertThat(fixture.codeRepository.findByCodeHash(SecureTokens.hash(code)).orElseThrow().codeChallenge).isNull();
        assertThat(response.access_token()).isNotBlank();
        assertThat(response.id_token()).isNotBlank();
    }

    @Test
    @DisplayName("exchange should still check the verifier when a PKCE-optional client sent a challenge")
    void exchange_shouldVerifyPkce_whenOptionalClientSentChallenge() {
        fixture.clientRegistry.register(new ClientRegistry.Registration("legacy-backend", "Legacy backend", null,
            List.of("https://legacy.example.test/cb"), null, true, "legacy-secret-0123456789", false));
        String code = fixture.issueCode(fixture.request("legacy-backend", "https://legacy.example.test/cb", "openid", "s"));

        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials("legacy-backend", "legacy-secret-0123456789"), code,
                "https://legacy.example.test/cb", null)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should reject an unknown code")
    void exchange_shouldReject_whenCodeUnknown() {
        assertError(() -> service.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), "made-up", PUBLIC_REDIRECT, VERIFIER)),
            OAuthError.INVALID_GRANT);
    }

    // ========================================
    // REFRESH TOKEN ROTATION
    // ========================================

    @Test
    @DisplayName("refresh should rotate the refresh token")
    void refresh_shouldRotateToken() {
        // Arrange
        TokenResponse initial = fixture.exchangePublicCode("openid profile");

        // Act
        TokenResponse refreshed = service.exchange(fixture.publicRefresh(initial.refresh_token(), null));

        // Assert
        assertThat(refreshed.refresh_token()).isNotEqualTo(initial.refresh_token());
        assertThat(refreshed.scope()).isEqualTo("openid profile");
        assertThat(refreshed.id_token()).isNull();

        RefreshToken old = fixture.refreshTokenRepository
            .findByTokenHash(SecureTokens.hash(initial.refresh_token())).orElseThrow();
        RefreshToken next = fixture.refreshTokenRepository
            .findByTokenHash(SecureTokens.hash(refreshed.refresh_token())).orElseThrow();
        assertThat(old.revoked).isTrue();
        assertThat(old.replacedBy).isEqualTo(next.tokenHash);
        assertThat(next.rotatedFrom).isEqualTo(old.tokenHash);
        assertThat(next.tokenFamily).isEqualTo(old.tokenFamily);
        assertThat(next.revoked).isFalse();
    }

    @Test
    @DisplayName("refresh should revoke the whole family when a rotated token is reused")
    void refresh_shouldRevokeFamily_whenRotatedTokenReused() {
        // Arrange
        TokenResponse initial = fixture.exchangePublicCode("openid");
        TokenResponse rotated = service.exchange(fixture.publicRefresh(initial.refresh_token(), null));

        // Act
        assertError(() -> service.exchange(fixture.publicRefresh(initial.refresh_token(), null)),
            OAuthError.INVALID_GRANT);

        // Assert
        assertThat(fixture.refreshTokenRepository.all()).allMatch(token -> token.revoked);
        assertError(() -> service.exchange(fixture.publicRefresh(rotated.refresh_token(), null)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("refresh should narrow the access token scope without shrinking the family")
    void refresh_shouldNarrowScope_whenSubsetRequested() {
        TokenResponse initial = fixture.exchangePublicCode("openid profile email");

        TokenResponse narrowed = service.exchange(fixture.publicRefresh(initial.refresh_token(), "email"));
        TokenResponse full = service.exchange(fixture.publicRefresh(narrowed.refresh_token(), null));

        assertThat(narrowed.scope()).isEqualTo("email");
        JsonWebToken access = fixture.keys.verify(narrowed.access_token(), PUBLIC_CLIENT).orElseThrow();
        assertThat(Claims.string(access, "scope")).isEqualTo("email");
        assertThat(full.scope()).isEqualTo("email openid profile");
    }

    @Test
    @DisplayName("refresh should reject a scope wider than the original grant")
    void refresh_shouldReject_whenScopeWidened() {
        TokenResponse initial = fixture.exchangePublicCode("openid");

        assertError(() -> service.exchange(fixture.publicRefresh(initial.refresh_token(), "openid email")),
            OAuthError.INVALID_SCOPE);

        RefreshToken stored = fixture.refreshTokenRepository
            .findByTokenHash(SecureTokens.hash(initial.refresh_token())).orElseThrow();
        assertThat(stored.revoked).isFalse();
    }

    @Test
    @DisplayName("refresh should reject a token presented by another client")
    void refresh_shouldReject_whenOtherClient() {
        TokenResponse initial = fixture.exchangePublicCode("openid");

        assertError(() -> service.exchange(new TokenGrant.RefreshTokenGrant(
                new ClientCredentials(CONFIDENTIAL_CLIENT, CONFIDENTIAL_SECRET), initial.refresh_token(), null)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("refresh should reject an expired token")
    void refresh_shouldReject_whenExpired() {
        TokenResponse initial = fixture.exchangePublicCode("openid");
        fixture.clock.advance(fixture.config.jwt.refreshTokenExpiry.plusSeconds(1));

        assertError(() -> service.exchange(fixture.publicRefresh(initial.refresh_token(), null)),
            OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should not issue a refresh token to a client without the refresh grant")
    void exchange_shouldOmitRefreshToken_whenRefreshGrantNotAllowed() {
        fixture.clientRegistry.register(new ClientRegistry.Registration("code-only", "Code only", null,
            List.of("https://c.example.test/cb"), List.of("authorization_code"), false, null, null));
        String code = fixture.issueCode(fixture.request("code-only", "https://c.example.test/cb", "openid", "s"));

        TokenResponse response = service.exchange(new TokenGrant.AuthorizationCodeGrant(
            new ClientCredentials("code-only", null), code, "https://c.example.test/cb", VERIFIER));

        assertThat(response.refresh_token()).isNull();
        assertThat(fixture.refreshTokenRepository.all()).isEmpty();
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    private static void assertError(Runnable call, OAuthError expected) {
        assertThatThrownBy(call::run)
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(expected);
    }
}
