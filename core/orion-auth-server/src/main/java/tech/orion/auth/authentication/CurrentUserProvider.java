package tech.orion.auth.authentication;

import jakarta.ws.rs.core.HttpHeaders;

import java.util.Optional;

/**
 * Resolves the end user of a browser request. The login experience itself lives
 * outside this server; it only has to leave something this provider understands.
 */
public interface CurrentUserProvider {

    Optional<AuthenticatedUser> currentUser(HttpHeaders headers);
}
