package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import tech.orion.auth.authentication.Claims;
import tech.orion.auth.authentication.JwtKeyService;
import tech.orion.auth.authentication.TokenService;
import tech.orion.auth.user.UserProfile;
import tech.orion.auth.user.UserProfileRepository;

import java.util.Map;

/**
 * OIDC userinfo: claims about the user behind an access token, limited to its scopes.
 */
@ApplicationScoped
public class UserInfoService {

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    UserProfileRepository userProfileRepository;

    /**
     * @throws OAuthException invalid_token if the token is not a live access token
     *                        or its user no longer exists
     */
    public Map<String, Object> userInfo(String accessToken) {
        JsonWebToken jwt = jwtKeyService.verify(accessToken, null)
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_TOKEN, "Access token is invalid or expired"));
        if (!TokenService.USE_ACCESS.equals(Claims.string(jwt, TokenService.TOKEN_USE))) {
            throw new OAuthException(OAuthError.INVALID_TOKEN, "Not an access token");
        }

        UserProfile profile = userProfileRepository.findByUserId(jwt.getSubject())
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_TOKEN, "User no longer exists"));
        return profile.claimsFor(Scopes.parse(Claims.string(jwt, "scope")));
    }
}
