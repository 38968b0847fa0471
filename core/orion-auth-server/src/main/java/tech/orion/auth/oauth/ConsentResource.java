package tech.orion.auth.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.orion.auth.authentication.AuthenticatedUser;
import tech.orion.auth.authentication.CurrentUserProvider;

import java.util.List;

/**
 * Backend of the consent screen. Both calls act on a parked authorization request and
 * require the user who started it. The UI follows the returned URL itself; this
 * resource never redirects.
 */
@Path("/api/oauth/consent")
@Tag(name = "OAuth2 Consent", description = "Consent prompt data and decisions")
@Produces(MediaType.APPLICATION_JSON)
public class ConsentResource {

    @Inject
    AuthorizationService authorizationService;

    @Inject
    CurrentUserProvider currentUserProvider;

    public record ClientInfo(
            @JsonProperty("client_id") String clientId,
            String name,
            String description
    ) {
    }

    public record ScopeInfo(String name, String description) {
    }

    public record ConsentPromptResponse(
            @JsonProperty("request_id") String requestId,
            ClientInfo client,
            List<ScopeInfo> scopes,
            @JsonProperty("redirect_uri") String redirectUri
    ) {
    }

    public record ConsentDecisionRequest(
            @JsonProperty("request_id") String requestId,
            Boolean approved
    ) {
    }

    public record ConsentDecisionResponse(
            @JsonProperty("redirect_url") String redirectUrl
    ) {
    }

    @GET
    @Operation(summary = "Describe a pending authorization request")
    @APIResponse(responseCode = "200", description = "Client and requested scopes")
    @APIResponse(responseCode = "400", description = "Unknown or expired request")
    @APIResponse(responseCode = "401", description = "Not logged in")
    public ConsentPromptResponse prompt(@QueryParam("request_id") String requestId, @Context HttpHeaders headers) {
        AuthorizationService.ConsentPrompt prompt = authorizationService.describeConsent(requestId, requireUser(headers));
        List<ScopeInfo> scopes = prompt.request().scopes().stream()
                .map(scope -> new ScopeInfo(scope, Scopes.describe(scope)))
                .toList();
        OAuthClient client = prompt.client();
        return new ConsentPromptResponse(prompt.request().id,
                new ClientInfo(client.clientId, client.name, client.description),
                scopes,
                prompt.request().redirectUri);
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Approve or deny a pending authorization request")
    @APIResponse(responseCode = "200", description = "URL the browser should follow")
    @APIResponse(responseCode = "400", description = "Unknown, expired or already decided request")
    @APIResponse(responseCode = "401", description = "Not logged in")
    public ConsentDecisionResponse decide(ConsentDecisionRequest decision, @Context HttpHeaders headers) {
        if (decision == null || decision.approved() == null) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "request_id and approved are required");
        }
        AuthenticatedUser user = requireUser(headers);

        String redirectUrl;
        try {
            redirectUrl = authorizationService.decideConsent(decision.requestId(), user, decision.approved());
        } catch (OAuthException e) {
            throw e;
        } catch (RuntimeException e) {
            // A concurrent approval can win the insert of the consent row
            throw new OAuthException(OAuthError.SERVER_ERROR, "Consent could not be recorded", e);
        }
        return new ConsentDecisionResponse(redirectUrl);
    }

    private AuthenticatedUser requireUser(HttpHeaders headers) {
        return currentUserProvider.currentUser(headers)
                .orElseThrow(() -> new OAuthException(OAuthError.LOGIN_REQUIRED, "Login required"));
    }
}
