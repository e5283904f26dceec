package tech.idplane.user;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Password hashing and verification with Argon2id.
 *
 * <p>Hashes are stored in PHC format ({@code $argon2id$v=19$m=65536,t=3,p=4$...}),
 * so the parameters travel with each hash and {@link #needsRehash(String)} can spot
 * hashes written with older settings.
 */
@ApplicationScoped
public class PasswordService {

    private static final int MEMORY_COST = 65536;  // KiB
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 128;

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * @return the PHC encoded hash
     * @throws IllegalArgumentException when the password is null or empty
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, plainPassword.toCharArray());
    }

    /**
     * Constant-time check of a password against a stored hash. A malformed hash never matches.
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        try {
            return argon2.verify(passwordHash, plainPassword.toCharArray());
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * True when the hash is not Argon2id or was produced with other cost parameters.
     */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith("$argon2id$")) {
            return true;
        }
        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        String params = parts[3];
        return !(params.contains("m=" + MEMORY_COST)
            && params.contains("t=" + ITERATIONS)
            && params.contains("p=" + PARALLELISM));
    }

    /**
     * @throws IllegalArgumentException when the password is outside the allowed length
     */
    public void validatePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "Password must be at most " + MAX_PASSWORD_LENGTH + " characters long");
        }
    }

    public String validateAndHashPassword(String plainPassword) {
        validatePassword(plainPassword);
        return hashPassword(plainPassword);
    }
}
