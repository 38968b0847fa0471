package tech.orion.auth.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z").
 */
public enum EntityType {

    OAUTH_CLIENT("oac"),
    AUTH_CODE("acd"),
    CONSENT("cns"),
    PENDING_AUTHORIZATION("par");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
