package tech.orion.auth.oauth;

/**
 * An OAuth protocol error. Rendered as {@code {error, error_description}} by
 * {@link OAuthExceptionMapper}, or turned into an error redirect by the
 * authorization endpoint once the redirect URI is trusted.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;

    public OAuthException(OAuthError error, String description) {
        super(description);
        this.error = error;
    }

    public OAuthException(OAuthError error, String description, Throwable cause) {
        super(description, cause);
        this.error = error;
    }

    public OAuthError error() {
        return error;
    }

    public String description() {
        return getMessage();
    }
}
