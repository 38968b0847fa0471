package tech.orion.auth.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.orion.auth.user.UserProfile;
import tech.orion.auth.user.UserProfileRepository;
import tech.orion.auth.user.entity.UserEntity;

import java.util.Optional;
import java.util.TreeSet;

@ApplicationScoped
public class PanacheUserProfileRepository implements UserProfileRepository, PanacheRepositoryBase<UserEntity, String> {

    @Override
    public Optional<UserProfile> findByUserId(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return find("id", userId).firstResultOptional().map(PanacheUserProfileRepository::toDomain);
    }

    private static UserProfile toDomain(UserEntity entity) {
        UserProfile profile = new UserProfile(entity.id, entity.name, entity.email);
        profile.emailVerified = entity.emailVerified;
        profile.company = entity.company;
        profile.jobTitle = entity.jobTitle;
        profile.roles = entity.roles != null ? new TreeSet<>(entity.roles) : new TreeSet<>();
        return profile;
    }
}
