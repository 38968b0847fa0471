package tech.orion.auth.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * TSIDs are time-sortable 64-bit ids rendered as 13 Crockford base32 characters.
 * Typed ids prepend the entity prefix, e.g. "par_0HZXEQ5Y8JY5Z".
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Extract the prefix from a typed ID.
     *
     * @throws IllegalArgumentException if the ID has no separator
     */
    public static String extractPrefix(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        return typedId.substring(0, separatorIndex);
    }

    private TsidGenerator() {
        // Utility class
    }
}
