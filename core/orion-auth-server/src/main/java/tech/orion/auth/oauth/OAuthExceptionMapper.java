package tech.orion.auth.oauth;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders {@link OAuthException} as the RFC 6749 error body.
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    private static final Logger LOG = Logger.getLogger(OAuthExceptionMapper.class);

    @Override
    public Response toResponse(OAuthException exception) {
        OAuthError error = exception.error();
        if (error == OAuthError.SERVER_ERROR) {
            LOG.error("OAuth request failed", exception.getCause() != null ? exception.getCause() : exception);
        } else {
            LOG.debugf("OAuth error %s: %s", error.code(), exception.description());
        }

        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error.code());
        if (exception.description() != null) {
            body.put("error_description", exception.description());
        }

        Response.ResponseBuilder response = Response.status(error.status())
                .type(MediaType.APPLICATION_JSON)
                .header("Cache-Control", "no-store")
                .header("Pragma", "no-cache")
                .entity(body);
        if (error == OAuthError.INVALID_CLIENT) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"orion\"");
        } else if (error.status() == Response.Status.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"" + error.code() + "\"");
        }
        return response.build();
    }
}
