package tech.orion.auth.authentication;

import java.time.Instant;

/**
 * The user behind the current request.
 *
 * @param authTime when the user last authenticated, null if unknown
 */
public record AuthenticatedUser(String userId, Instant authTime) {
}
