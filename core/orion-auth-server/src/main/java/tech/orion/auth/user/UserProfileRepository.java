package tech.orion.auth.user;

import java.util.Optional;

/**
 * Lookup of user profiles by user id.
 */
public interface UserProfileRepository {

    Optional<UserProfile> findByUserId(String userId);
}
