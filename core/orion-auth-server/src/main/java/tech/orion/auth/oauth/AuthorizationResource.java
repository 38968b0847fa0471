package tech.orion.auth.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.orion.auth.authentication.AuthConfig;
import tech.orion.auth.authentication.CurrentUserProvider;

import java.net.URI;
import java.util.Map;

/**
 * OAuth2 endpoints implementing:
 * - Authorization Code flow with PKCE
 * - Refresh token grant with rotation
 * - OIDC userinfo
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/draft-ietf-oauth-v2-1">OAuth 2.1</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    AuthConfig authConfig;

    @Inject
    AuthorizationService authorizationService;

    @Inject
    TokenGrantService tokenGrantService;

    @Inject
    UserInfoService userInfoService;

    @Inject
    CurrentUserProvider currentUserProvider;

    @Context
    UriInfo uriInfo;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=my-spa
     *   &redirect_uri=https://app.example.com/callback
     *   &scope=openid profile
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Operation(summary = "Start authorization code flow")
    @APIResponse(responseCode = "302", description = "Redirect to login, consent, or the client with a code or error")
    @APIResponse(responseCode = "400", description = "Request cannot be redirected (unknown client, unregistered redirect_uri)")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization, registered exactly")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state, echoed back verbatim")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method, S256 only")
            @QueryParam("code_challenge_method") String codeChallengeMethod,

            @Parameter(description = "OIDC nonce for replay protection")
            @QueryParam("nonce") String nonce,

            @Context HttpHeaders headers
    ) {
        AuthorizationRequest request = new AuthorizationRequest(responseType, clientId, redirectUri, scope, state,
                codeChallenge, codeChallengeMethod, nonce);

        AuthorizationOutcome outcome;
        try {
            outcome = authorizationService.authorize(request, currentUserProvider.currentUser(headers));
        } catch (OAuthException e) {
            throw e;
        } catch (RuntimeException e) {
            outcome = authorizationService.serverErrorRedirect(request, e);
        }

        if (outcome instanceof AuthorizationOutcome.LoginRequired) {
            String returnUrl = "/oauth/authorize?" + uriInfo.getRequestUri().getRawQuery();
            return found(RedirectUris.withParams(authConfig.loginUrl(), Map.of("returnUrl", returnUrl)));
        }
        if (outcome instanceof AuthorizationOutcome.ConsentRequired consent) {
            return found(RedirectUris.withParams(authConfig.consentUrl(), Map.of("request_id", consent.requestId())));
        }
        return found(((AuthorizationOutcome.Redirect) outcome).location());
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     *
     * Supports:
     * - authorization_code: Exchange code for tokens
     * - refresh_token: Rotate a refresh token for new tokens
     *
     * Clients authenticate with HTTP Basic, with client_id/client_secret in the body,
     * or (public clients) with client_id alone.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange authorization code or refresh token for tokens")
    @APIResponse(responseCode = "200", description = "Tokens issued")
    @APIResponse(responseCode = "400", description = "invalid_request, invalid_grant, invalid_scope, unsupported_grant_type")
    @APIResponse(responseCode = "401", description = "invalid_client")
    public Response token(
            MultivaluedMap<String, String> form,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader
    ) {
        TokenGrant grant = TokenGrant.parse(form, authHeader);

        TokenResponse tokens;
        try {
            tokens = tokenGrantService.exchange(grant);
        } catch (OAuthException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OAuthException(OAuthError.SERVER_ERROR, "Token issuance failed", e);
        }

        return Response.ok(tokens)
                .header("Cache-Control", "no-store")
                .header("Pragma", "no-cache")
                .build();
    }

    // ==================== UserInfo Endpoint ====================

    @GET
    @Path("/userinfo")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Claims about the user behind an access token")
    @APIResponse(responseCode = "200", description = "User claims permitted by the token's scopes")
    @APIResponse(responseCode = "401", description = "invalid_token")
    public Response userinfo(@HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader) {
        if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new OAuthException(OAuthError.INVALID_TOKEN, "Bearer access token required");
        }
        Map<String, Object> claims = userInfoService.userInfo(authHeader.substring(BEARER_PREFIX.length()).trim());
        LOG.debugf("Userinfo served for %s", claims.get("sub"));
        return Response.ok(claims)
                .header("Cache-Control", "no-store")
                .build();
    }

    private static Response found(String location) {
        return Response.status(Response.Status.FOUND)
                .location(URI.create(location))
                .header("Cache-Control", "no-store")
                .build();
    }
}
