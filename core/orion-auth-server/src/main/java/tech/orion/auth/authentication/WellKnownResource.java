package tech.orion.auth.authentication;

import jakarta.inject.Inject;
import jakarta.json.JsonObject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Well-known endpoints for OAuth2/OIDC discovery.
 * Lets resource servers discover this server and verify its tokens.
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2/OIDC discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    /**
     * JSON Web Key Set (JWKS) endpoint.
     * Returns the public keys used to verify tokens, including keys retired by a recent rotation.
     */
    @GET
    @Path("/jwks.json")
    @Operation(summary = "Get JSON Web Key Set for token verification")
    @APIResponse(responseCode = "200", description = "JWKS document")
    public JsonObject jwks() {
        return jwtKeyService.getJwks();
    }

    /**
     * OpenID Connect Discovery endpoint.
     */
    @GET
    @Path("/openid-configuration")
    @Operation(summary = "Get OpenID Connect discovery document")
    @APIResponse(responseCode = "200", description = "OpenID configuration")
    public JsonObject openIdConfiguration() {
        return jwtKeyService.getOpenIdConfiguration(getBaseUrl(), authConfig.supportedScopes());
    }

    private String getBaseUrl() {
        return authConfig.externalBaseUrl()
                .orElse(uriInfo.getBaseUri().toString())
                .replaceAll("/$", "");
    }
}
