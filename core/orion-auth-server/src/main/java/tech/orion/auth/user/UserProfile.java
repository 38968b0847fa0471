package tech.orion.auth.user;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view of a user as the authorization server needs it for
 * ID token and userinfo claims. The user directory itself is owned elsewhere.
 */
public class UserProfile {

    public static final String SCOPE_PROFILE = "profile";
    public static final String SCOPE_EMAIL = "email";
    public static final String SCOPE_ROLES = "roles";

    public String id;
    public String name;
    public String email;
    public boolean emailVerified;
    public String company;
    public String jobTitle;
    public Set<String> roles = new TreeSet<>();

    public UserProfile() {
    }

    public UserProfile(String id, String name, String email) {
        this.id = id;
        this.name = name;
        this.email = email;
    }

    /**
     * Claims this user exposes for the granted scopes, {@code sub} always included.
     * <ul>
     *   <li>profile: name, company, job_title</li>
     *   <li>email: email, email_verified</li>
     *   <li>roles: roles</li>
     * </ul>
     * Null attributes are omitted.
     */
    public Map<String, Object> claimsFor(Set<String> scopes) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", id);
        if (scopes.contains(SCOPE_PROFILE)) {
            putIfPresent(claims, "name", name);
            putIfPresent(claims, "company", company);
            putIfPresent(claims, "job_title", jobTitle);
        }
        if (scopes.contains(SCOPE_EMAIL) && email != null) {
            claims.put("email", email);
            claims.put("email_verified", emailVerified);
        }
        if (scopes.contains(SCOPE_ROLES)) {
            claims.put("roles", new TreeSet<>(roles));
        }
        return claims;
    }

    private static void putIfPresent(Map<String, Object> claims, String name, String value) {
        if (value != null) {
            claims.put(name, value);
        }
    }
}
