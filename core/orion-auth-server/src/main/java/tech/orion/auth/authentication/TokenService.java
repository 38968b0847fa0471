package tech.orion.auth.authentication;

import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.orion.auth.user.UserProfile;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Mints the JWTs this server hands out. Signing is delegated to {@link JwtKeyService}.
 *
 * Every token carries a {@code token_use} claim so an ID token or a session token
 * cannot be replayed where an access token is expected.
 */
@ApplicationScoped
public class TokenService {

    public static final String TOKEN_USE = "token_use";
    public static final String USE_ACCESS = "access";
    public static final String USE_ID = "id";
    public static final String USE_SESSION = "session";
    public static final String SESSION_AUDIENCE = "orion-session";

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    AuthConfig config;

    @Inject
    Clock clock;

    /**
     * Issue an access token for a user acting through a client.
     *
     * @param scope normalized space-separated scope string
     */
    public String issueAccessToken(String userId, String clientId, String scope) {
        Instant now = clock.instant();
        JwtClaimsBuilder claims = Jwt.issuer(jwtKeyService.getIssuer())
                .subject(userId)
                .audience(clientId)
                .claim("client_id", clientId)
                .claim("scope", scope)
                .claim(TOKEN_USE, USE_ACCESS)
                .claim("jti", UUID.randomUUID().toString())
                .issuedAt(now)
                .expiresAt(now.plus(config.jwt().accessTokenExpiry()));
        return jwtKeyService.sign(claims);
    }

    /**
     * Issue an OIDC ID token. Profile claims are included only for the granted scopes.
     *
     * @param profile the user, or null if the directory no longer knows them
     * @param nonce   the nonce from the authorization request, may be null
     * @param authTime when the user authenticated, may be null
     */
    public String issueIdToken(String userId, UserProfile profile, String clientId, Set<String> scopes,
                               String nonce, Instant authTime) {
        Instant now = clock.instant();
        JwtClaimsBuilder claims = Jwt.issuer(jwtKeyService.getIssuer())
                .subject(userId)
                .audience(clientId)
                .claim(TOKEN_USE, USE_ID)
                .issuedAt(now)
                .expiresAt(now.plus(config.jwt().idTokenExpiry()));

        if (authTime != null) {
            claims.claim("auth_time", authTime.getEpochSecond());
        }
        if (nonce != null) {
            claims.claim("nonce", nonce);
        }
        if (profile != null) {
            for (Map.Entry<String, Object> claim : profile.claimsFor(scopes).entrySet()) {
                if (!"sub".equals(claim.getKey())) {
                    claims.claim(claim.getKey(), claim.getValue());
                }
            }
        }
        return jwtKeyService.sign(claims);
    }

    /**
     * Issue the session token the login UI stores in the session cookie.
     */
    public String issueSessionToken(String userId) {
        Instant now = clock.instant();
        JwtClaimsBuilder claims = Jwt.issuer(jwtKeyService.getIssuer())
                .subject(userId)
                .audience(SESSION_AUDIENCE)
                .claim(TOKEN_USE, USE_SESSION)
                .issuedAt(now)
                .expiresAt(now.plus(config.session().tokenExpiry()));
        return jwtKeyService.sign(claims);
    }
}
