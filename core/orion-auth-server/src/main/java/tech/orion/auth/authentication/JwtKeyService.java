package tech.orion.auth.authentication;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the RS256 signing keys and everything that depends on them.
 *
 * One key pair is active for signing. Public keys of earlier pairs stay in the
 * verification set, keyed by {@code kid}, so tokens issued before a rotation keep
 * verifying until they expire. Keys are loaded from PEM files, or in development
 * generated once and persisted to {@code dev-key-dir}.
 *
 * The key ring is an immutable snapshot swapped atomically on rotation; readers
 * never lock.
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    public static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    @Inject
    AuthConfig config;

    @Inject
    Clock clock;

    private volatile KeyRing keyRing;

    /**
     * A key known to this server. {@code privateKey} is null for verification-only keys.
     * {@code retiredAt} is set when a rotation demoted the key; null keys loaded from
     * configuration are kept until the configuration drops them.
     */
    public record SigningKey(String keyId, RSAPublicKey publicKey, RSAPrivateKey privateKey, Instant retiredAt) {
    }

    private record KeyRing(SigningKey active, Map<String, SigningKey> retired) {
    }

    @PostConstruct
    void init() {
        try {
            KeyPair active;
            if (config.jwt().privateKeyPath().isPresent() && config.jwt().publicKeyPath().isPresent()) {
                active = loadKeysFromFiles(config.jwt().privateKeyPath().get(), config.jwt().publicKeyPath().get());
            } else {
                active = loadOrGenerateDevKeys();
            }

            Map<String, SigningKey> retired = new LinkedHashMap<>();
            if (config.jwt().previousPublicKeyPath().isPresent()) {
                RSAPublicKey previous = readPublicKey(Path.of(config.jwt().previousPublicKeyPath().get()));
                SigningKey previousKey = new SigningKey(generateKeyId(previous), previous, null, null);
                retired.put(previousKey.keyId(), previousKey);
                LOG.infof("Previous JWT public key loaded for verification, key ID: %s", previousKey.keyId());
            }

            SigningKey activeKey = toSigningKey(active);
            retired.remove(activeKey.keyId());
            this.keyRing = new KeyRing(activeKey, Map.copyOf(retired));
            LOG.infof("JWT key service initialized with key ID: %s", activeKey.keyId());
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
    }

    /**
     * Load dev keys from the local directory, or generate and persist new ones.
     * Sessions and tokens then survive restarts during development.
     */
    private KeyPair loadOrGenerateDevKeys() throws IOException, GeneralSecurityException {
        Path keyDir = Path.of(config.jwt().devKeyDir());
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        KeyPair keyPair;
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            RSAPublicKey publicKey = (RSAPublicKey) keyFactory.generatePublic(
                    new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
            RSAPrivateKey privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                    new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            keyPair = new KeyPair(publicKey, privateKey);
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            keyPair = generateKeyPair();
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, keyPair.getPrivate().getEncoded());
            Files.write(publicKeyFile, keyPair.getPublic().getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure orion.auth.jwt.private-key-path and orion.auth.jwt.public-key-path for production.");
        return keyPair;
    }

    private KeyPair loadKeysFromFiles(String privateKeyPath, String publicKeyPath)
            throws IOException, GeneralSecurityException {
        LOG.info("Loading JWT keys from files");
        String privateKeyPem = Files.readString(Path.of(privateKeyPath), StandardCharsets.US_ASCII);
        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        RSAPrivateKey privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                new PKCS8EncodedKeySpec(parsePemKey(privateKeyPem, "PRIVATE KEY")));
        return new KeyPair(readPublicKey(Path.of(publicKeyPath)), privateKey);
    }

    private RSAPublicKey readPublicKey(Path path) throws IOException, GeneralSecurityException {
        String pem = Files.readString(path, StandardCharsets.US_ASCII);
        return (RSAPublicKey) KeyFactory.getInstance("RSA")
                .generatePublic(new X509EncodedKeySpec(parsePemKey(pem, "PUBLIC KEY")));
    }

    private byte[] parsePemKey(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    static KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        return keyGen.generateKeyPair();
    }

    private SigningKey toSigningKey(KeyPair keyPair) {
        RSAPublicKey publicKey = (RSAPublicKey) keyPair.getPublic();
        return new SigningKey(generateKeyId(publicKey), publicKey, (RSAPrivateKey) keyPair.getPrivate(), null);
    }

    private String generateKeyId(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Make {@code next} the signing key. The current key becomes verification-only
     * and is dropped once every token it could have signed has expired.
     */
    public synchronized void rotate(KeyPair next) {
        KeyRing current = keyRing;
        SigningKey nextKey = toSigningKey(next);
        SigningKey demoted = new SigningKey(current.active().keyId(), current.active().publicKey(), null, clock.instant());

        Map<String, SigningKey> retired = new LinkedHashMap<>(current.retired());
        retired.put(demoted.keyId(), demoted);
        retired.remove(nextKey.keyId());
        this.keyRing = new KeyRing(nextKey, Map.copyOf(retired));
        LOG.infof("JWT signing key rotated from %s to %s", demoted.keyId(), nextKey.keyId());
    }

    /**
     * Sign the claims with the active key, stamping its {@code kid} into the header.
     */
    public String sign(JwtClaimsBuilder claims) {
        SigningKey active = keyRing.active();
        return claims.jws()
                .keyId(active.keyId())
                .sign(active.privateKey());
    }

    /**
     * Verify signature (selected by {@code kid}), issuer, expiry and, when given, audience.
     *
     * @return the parsed token, or empty if any check fails
     */
    public Optional<JsonWebToken> verify(String token, String expectedAudience) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            String kid = readKeyId(token);
            SigningKey key = kid == null ? keyRing.active() : verificationKeys().get(kid);
            if (key == null) {
                LOG.debugf("Token signed with unknown key ID: %s", kid);
                return Optional.empty();
            }

            JWTParser parser = new DefaultJWTParser();
            JsonWebToken jwt = parser.verify(token, key.publicKey());

            if (!getIssuer().equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", getIssuer(), jwt.getIssuer());
                return Optional.empty();
            }
            if (jwt.getExpirationTime() <= clock.instant().getEpochSecond()) {
                LOG.debug("Token expired");
                return Optional.empty();
            }
            if (expectedAudience != null) {
                Set<String> audience = jwt.getAudience();
                if (audience == null || !audience.contains(expectedAudience)) {
                    LOG.debugf("Token audience mismatch: expected %s, got %s", expectedAudience, audience);
                    return Optional.empty();
                }
            }
            return Optional.of(jwt);
        } catch (ParseException | RuntimeException e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private String readKeyId(String token) {
        int dot = token.indexOf('.');
        if (dot <= 0) {
            throw new IllegalArgumentException("Token is not a compact JWS");
        }
        String headerJson = new String(Base64.getUrlDecoder().decode(token.substring(0, dot)), StandardCharsets.UTF_8);
        try (JsonReader reader = Json.createReader(new StringReader(headerJson))) {
            JsonObject header = reader.readObject();
            return header.getString("kid", null);
        }
    }

    /**
     * Active key plus retired keys that may still have live tokens.
     */
    Map<String, SigningKey> verificationKeys() {
        KeyRing ring = keyRing;
        Instant cutoff = clock.instant().minus(maxTokenLifetime());
        Map<String, SigningKey> keys = new LinkedHashMap<>();
        keys.put(ring.active().keyId(), ring.active());
        for (SigningKey key : ring.retired().values()) {
            if (key.retiredAt() == null || key.retiredAt().isAfter(cutoff)) {
                keys.put(key.keyId(), key);
            }
        }
        return keys;
    }

    private Duration maxTokenLifetime() {
        Duration max = config.jwt().accessTokenExpiry();
        if (config.jwt().idTokenExpiry().compareTo(max) > 0) {
            max = config.jwt().idTokenExpiry();
        }
        if (config.session().tokenExpiry().compareTo(max) > 0) {
            max = config.session().tokenExpiry();
        }
        return max;
    }

    /**
     * Get the JWKS (JSON Web Key Set) with every key that can still verify tokens.
     */
    public JsonObject getJwks() {
        JsonArrayBuilder keysArray = Json.createArrayBuilder();
        for (SigningKey key : verificationKeys().values()) {
            keysArray.add(toJwk(key));
        }
        return Json.createObjectBuilder()
                .add("keys", keysArray)
                .build();
    }

    private JsonObject toJwk(SigningKey key) {
        byte[] nBytes = key.publicKey().getModulus().toByteArray();
        byte[] eBytes = key.publicKey().getPublicExponent().toByteArray();

        // Remove leading zero byte if present (BigInteger sign bit)
        if (nBytes[0] == 0) {
            byte[] tmp = new byte[nBytes.length - 1];
            System.arraycopy(nBytes, 1, tmp, 0, tmp.length);
            nBytes = tmp;
        }

        return Json.createObjectBuilder()
                .add("kty", "RSA")
                .add("alg", ALGORITHM)
                .add("use", "sig")
                .add("kid", key.keyId())
                .add("n", Base64.getUrlEncoder().withoutPadding().encodeToString(nBytes))
                .add("e", Base64.getUrlEncoder().withoutPadding().encodeToString(eBytes))
                .build();
    }

    /**
     * Get the OpenID Connect discovery document. Advertises only what the server implements.
     */
    public JsonObject getOpenIdConfiguration(String baseUrl, Collection<String> supportedScopes) {
        return Json.createObjectBuilder()
                .add("issuer", getIssuer())
                .add("authorization_endpoint", baseUrl + "/oauth/authorize")
                .add("token_endpoint", baseUrl + "/oauth/token")
                .add("userinfo_endpoint", baseUrl + "/oauth/userinfo")
                .add("jwks_uri", baseUrl + "/.well-known/jwks.json")
                .add("response_types_supported", Json.createArrayBuilder().add("code"))
                .add("grant_types_supported", Json.createArrayBuilder()
                        .add("authorization_code")
                        .add("refresh_token"))
                .add("scopes_supported", Json.createArrayBuilder(new TreeSet<>(supportedScopes)))
                .add("token_endpoint_auth_methods_supported", Json.createArrayBuilder()
                        .add("client_secret_basic")
                        .add("client_secret_post")
                        .add("none"))
                .add("code_challenge_methods_supported", Json.createArrayBuilder().add("S256"))
                .add("subject_types_supported", Json.createArrayBuilder().add("public"))
                .add("id_token_signing_alg_values_supported", Json.createArrayBuilder().add(ALGORITHM))
                .add("claims_supported", Json.createArrayBuilder()
                        .add("sub")
                        .add("iss")
                        .add("aud")
                        .add("exp")
                        .add("iat")
                        .add("auth_time")
                        .add("nonce")
                        .add("name")
                        .add("email")
                        .add("email_verified")
                        .add("company")
                        .add("job_title")
                        .add("roles"))
                .build();
    }

    public String getIssuer() {
        return config.jwt().issuer();
    }

    public String getActiveKeyId() {
        return keyRing.active().keyId();
    }
}
