package tech.orion.auth.oauth;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scope string handling. Scopes are stored and compared in normalized form:
 * deduplicated, sorted, space-separated.
 */
public final class Scopes {

    public static final String OPENID = "openid";
    public static final String OFFLINE_ACCESS = "offline_access";

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "openid", "Sign you in with your Orion account",
            "profile", "View your name, company and job title",
            "email", "View your email address",
            "roles", "View the roles assigned to you",
            "offline_access", "Keep access while you are away");

    public static Set<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return Collections.emptySortedSet();
        }
        Set<String> scopes = new TreeSet<>();
        for (String token : scope.trim().split("\\s+")) {
            scopes.add(token);
        }
        return Collections.unmodifiableSet(scopes);
    }

    public static String format(Collection<String> scopes) {
        return String.join(" ", new TreeSet<>(scopes));
    }

    public static String normalize(String scope) {
        return format(parse(scope));
    }

    public static String describe(String scope) {
        return DESCRIPTIONS.getOrDefault(scope, scope);
    }

    private Scopes() {
        // Utility class
    }
}
