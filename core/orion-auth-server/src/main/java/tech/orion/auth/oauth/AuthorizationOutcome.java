package tech.orion.auth.oauth;

/**
 * Where the authorization endpoint sends the browser next.
 */
public sealed interface AuthorizationOutcome {

    /**
     * No authenticated user. Send them to log in and come back to the same request.
     */
    record LoginRequired() implements AuthorizationOutcome {
    }

    /**
     * The request is parked until the user decides.
     */
    record ConsentRequired(String requestId) implements AuthorizationOutcome {
    }

    /**
     * Back to the client's redirect URI, carrying either a code or an error.
     */
    record Redirect(String location) implements AuthorizationOutcome {
    }
}
