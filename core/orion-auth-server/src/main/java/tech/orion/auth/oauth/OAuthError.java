package tech.orion.auth.oauth;

import jakarta.ws.rs.core.Response;

/**
 * OAuth 2.1 / OIDC error codes as they appear on the wire, with the HTTP status
 * used when the error is returned directly rather than via redirect.
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request", Response.Status.BAD_REQUEST),
    INVALID_CLIENT("invalid_client", Response.Status.UNAUTHORIZED),
    INVALID_GRANT("invalid_grant", Response.Status.BAD_REQUEST),
    UNAUTHORIZED_CLIENT("unauthorized_client", Response.Status.BAD_REQUEST),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", Response.Status.BAD_REQUEST),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", Response.Status.BAD_REQUEST),
    INVALID_SCOPE("invalid_scope", Response.Status.BAD_REQUEST),
    ACCESS_DENIED("access_denied", Response.Status.FORBIDDEN),
    INVALID_TOKEN("invalid_token", Response.Status.UNAUTHORIZED),
    LOGIN_REQUIRED("login_required", Response.Status.UNAUTHORIZED),
    SERVER_ERROR("server_error", Response.Status.INTERNAL_SERVER_ERROR);

    private final String code;
    private final Response.Status status;

    OAuthError(String code, Response.Status status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public Response.Status status() {
        return status;
    }
}
