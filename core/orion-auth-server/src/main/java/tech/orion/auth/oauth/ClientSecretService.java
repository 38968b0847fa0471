package tech.orion.auth.oauth;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Client secret hashing using Argon2id.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 */
@ApplicationScoped
public class ClientSecretService {

    private static final Logger LOG = Logger.getLogger(ClientSecretService.class);

    private static final int MEMORY_COST = 65536;
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;

    public ClientSecretService() {
        this.argon2 = Argon2Factory.create(
                Argon2Factory.Argon2Types.ARGON2id,
                SALT_LENGTH,
                HASH_LENGTH
        );
    }

    /**
     * A fresh random secret. Returned to the caller once and never stored in plaintext.
     */
    public String generateSecret() {
        return SecureTokens.generate();
    }

    /**
     * @return the hash in PHC format ($argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hashSecret(String plainSecret) {
        if (plainSecret == null || plainSecret.isEmpty()) {
            throw new IllegalArgumentException("Client secret cannot be null or empty");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, plainSecret.toCharArray());
    }

    /**
     * Constant-time verification of a presented secret.
     */
    public boolean verifySecret(String plainSecret, String secretHash) {
        if (plainSecret == null || secretHash == null) {
            return false;
        }
        try {
            return argon2.verify(secretHash, plainSecret.toCharArray());
        } catch (RuntimeException e) {
            LOG.warnf("Stored client secret hash could not be verified: %s", e.getMessage());
            return false;
        }
    }
}
