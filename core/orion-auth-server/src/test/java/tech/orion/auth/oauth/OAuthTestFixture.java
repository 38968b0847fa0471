package tech.orion.auth.oauth;

import tech.orion.auth.authentication.AuthenticatedUser;
import tech.orion.auth.authentication.AuthenticationTestSupport;
import tech.orion.auth.authentication.JwtKeyService;
import tech.orion.auth.authentication.TestAuthConfig;
import tech.orion.auth.authentication.TokenService;
import tech.orion.auth.shared.MutableClock;
import tech.orion.auth.user.UserProfile;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The OAuth services wired by hand over in-memory repositories, with one public
 * and one confidential client registered.
 */
final class OAuthTestFixture {

    static final String USER_ID = "usr_0001";
    static final String PUBLIC_CLIENT = "spa-client";
    static final String PUBLIC_REDIRECT = "https://app.example.test/callback";
    static final String CONFIDENTIAL_CLIENT = "backend-client";
    static final String CONFIDENTIAL_SECRET = "backend-secret-0123456789";
    static final String CONFIDENTIAL_REDIRECT = "https://backend.example.test/callback";

    // RFC 7636 appendix B
    static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    final MutableClock clock = MutableClock.startingNow();
    final TestAuthConfig config;
    final JwtKeyService keys;
    final TokenService tokens;

    final InMemoryRepositories.Clients clientRepository = new InMemoryRepositories.Clients();
    final InMemoryRepositories.Codes codeRepository = new InMemoryRepositories.Codes();
    final InMemoryRepositories.Consents consentRepository = new InMemoryRepositories.Consents();
    final InMemoryRepositories.Pending pendingRepository = new InMemoryRepositories.Pending();
    final InMemoryRepositories.RefreshTokens refreshTokenRepository = new InMemoryRepositories.RefreshTokens();
    final Map<String, UserProfile> users = new HashMap<>();

    final PkceService pkceService = new PkceService();
    final ClientSecretService secretService = new ClientSecretService();
    final ClientRegistry clientRegistry = new ClientRegistry();
    final ConsentService consentService = new ConsentService();
    final AuthorizationService authorizationService = new AuthorizationService();
    final TokenGrantService tokenGrantService = new TokenGrantService();
    final UserInfoService userInfoService = new UserInfoService();

    OAuthTestFixture(Path keyDir) {
        config = new TestAuthConfig(keyDir);
        keys = AuthenticationTestSupport.jwtKeyService(config, clock);
        tokens = AuthenticationTestSupport.tokenService(keys, config, clock);

        clientRegistry.clientRepository = clientRepository;
        clientRegistry.secretService = secretService;
        clientRegistry.clock = clock;

        consentService.consentRepository = consentRepository;
        consentService.clock = clock;

        authorizationService.clientRegistry = clientRegistry;
        authorizationService.consentService = consentService;
        authorizationService.pkceService = pkceService;
        authorizationService.codeRepository = codeRepository;
        authorizationService.pendingRepository = pendingRepository;
        authorizationService.config = config;
        authorizationService.clock = clock;

        tokenGrantService.clientRegistry = clientRegistry;
        tokenGrantService.pkceService = pkceService;
        tokenGrantService.codeRepository = codeRepository;
        tokenGrantService.refreshTokenRepository = refreshTokenRepository;
        tokenGrantService.userProfileRepository = userId -> Optional.ofNullable(users.get(userId));
        tokenGrantService.tokenService = tokens;
        tokenGrantService.config = config;
        tokenGrantService.clock = clock;

        userInfoService.jwtKeyService = keys;
        userInfoService.userProfileRepository = userId -> Optional.ofNullable(users.get(userId));

        UserProfile alice = new UserProfile(USER_ID, "Alice Example", "alice@example.test");
        alice.emailVerified = true;
        alice.company = "Example Corp";
        alice.roles = Set.of("admin", "viewer");
        users.put(USER_ID, alice);

        clientRegistry.register(new ClientRegistry.Registration(PUBLIC_CLIENT, "Example SPA", null,
                List.of(PUBLIC_REDIRECT), null, false, null, null));
        clientRegistry.register(new ClientRegistry.Registration(CONFIDENTIAL_CLIENT, "Example Backend", null,
                List.of(CONFIDENTIAL_REDIRECT), null, true, CONFIDENTIAL_SECRET, null));
    }

    AuthenticatedUser user() {
        return new AuthenticatedUser(USER_ID, clock.instant().minusSeconds(30));
    }

    AuthorizationRequest request(String clientId, String redirectUri, String scope, String state) {
        return new AuthorizationRequest("code", clientId, redirectUri, scope, state, CHALLENGE,
                PkceService.METHOD_S256, "n-0S6_WzA2Mj");
    }

    AuthorizationRequest publicRequest(String scope) {
        return request(PUBLIC_CLIENT, PUBLIC_REDIRECT, scope, "xyz");
    }

    /**
     * Grant consent up front, run the request and return the issued code.
     */
    String issueCode(AuthorizationRequest request) {
        consentService.grant(USER_ID, request.clientId(), Scopes.parse(request.scope()));
        AuthorizationOutcome outcome = authorizationService.authorize(request, Optional.of(user()));
        return queryParam(((AuthorizationOutcome.Redirect) outcome).location(), "code");
    }

    TokenResponse exchangePublicCode(String scope) {
        String code = issueCode(publicRequest(scope));
        return tokenGrantService.exchange(new TokenGrant.AuthorizationCodeGrant(
                new ClientCredentials(PUBLIC_CLIENT, null), code, PUBLIC_REDIRECT, VERIFIER));
    }

    TokenGrant.RefreshTokenGrant publicRefresh(String refreshToken, String scope) {
        return new TokenGrant.RefreshTokenGrant(new ClientCredentials(PUBLIC_CLIENT, null), refreshToken, scope);
    }

    static String queryParam(String url, String name) {
        int query = url.indexOf('?');
        if (query < 0) {
            return null;
        }
        for (String pair : url.substring(query + 1).split("&")) {
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            if (key.equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
