package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange), S256 only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client sends code_challenge = BASE64URL(SHA256(code_verifier)) when authorizing
 * 3. Server stores code_challenge with the authorization code
 * 4. Client sends code_verifier in the token request
 * 5. Server verifies SHA256(code_verifier) == stored code_challenge
 *
 * The {@code plain} method is not accepted.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final Pattern VERIFIER = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");
    private static final Pattern CHALLENGE = Pattern.compile("^[A-Za-z0-9\\-_]{43}$");

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String computeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier matches the stored challenge.
     *
     * @param method must be S256; anything else fails
     */
    public boolean verify(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null || !METHOD_S256.equals(method)) {
            return false;
        }
        if (!isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        byte[] computed = computeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(computed, codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * An S256 challenge is a 32-byte digest, 43 base64url characters.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return codeChallenge != null && CHALLENGE.matcher(codeChallenge).matches();
    }

    /**
     * Per RFC 7636: 43-128 characters, unreserved characters only.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null && VERIFIER.matcher(codeVerifier).matches();
    }
}
