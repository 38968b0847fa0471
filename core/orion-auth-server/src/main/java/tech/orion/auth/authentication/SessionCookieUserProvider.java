package tech.orion.auth.authentication;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Default {@link CurrentUserProvider}: the session cookie holds a session JWT
 * signed by this server (see {@link TokenService#issueSessionToken(String)}).
 */
@ApplicationScoped
@DefaultBean
public class SessionCookieUserProvider implements CurrentUserProvider {

    private static final Logger LOG = Logger.getLogger(SessionCookieUserProvider.class);

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    AuthConfig config;

    @Override
    public Optional<AuthenticatedUser> currentUser(HttpHeaders headers) {
        Cookie cookie = headers.getCookies().get(config.session().cookieName());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return resolve(cookie.getValue());
    }

    Optional<AuthenticatedUser> resolve(String sessionToken) {
        Optional<JsonWebToken> verified = jwtKeyService.verify(sessionToken, TokenService.SESSION_AUDIENCE);
        if (verified.isEmpty()) {
            return Optional.empty();
        }
        JsonWebToken jwt = verified.get();
        if (!TokenService.USE_SESSION.equals(Claims.string(jwt, TokenService.TOKEN_USE))) {
            LOG.debugf("Session cookie carried a %s token", Claims.string(jwt, TokenService.TOKEN_USE));
            return Optional.empty();
        }
        Instant authTime = jwt.getIssuedAtTime() > 0 ? Instant.ofEpochSecond(jwt.getIssuedAtTime()) : null;
        return Optional.of(new AuthenticatedUser(jwt.getSubject(), authTime));
    }
}
