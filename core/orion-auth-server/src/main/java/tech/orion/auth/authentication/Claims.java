package tech.orion.auth.authentication;

import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;

/**
 * Claim accessors that smooth over the JSON-P values the JWT parser may return.
 */
public final class Claims {

    public static String string(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        if (value == null) {
            return null;
        }
        if (value instanceof JsonString jsonString) {
            return jsonString.getString();
        }
        return value.toString();
    }

    private Claims() {
        // Utility class
    }
}
