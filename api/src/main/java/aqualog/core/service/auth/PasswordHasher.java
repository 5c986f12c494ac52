package aqualog.core.service.auth;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.HexFormat;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import aqualog.core.config.CredentialPolicyConfig;

/**
 * One-way password hashing with PBKDF2-HMAC-SHA256.
 *
 * <p>Hashes are serialized as {@code pbkdf2-sha256$<iterations>$<hex digest>}.
 * The iteration count travels with the hash, so raising
 * {@code aqualog.auth.credentials.hash-iterations} leaves existing hashes
 * verifiable.
 *
 * <p>Comparison uses {@link MessageDigest#isEqual}, which runs in time
 * independent of where the digests differ.
 */
@ApplicationScoped
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String FORMAT_PREFIX = "pbkdf2-sha256";
    private static final String SEPARATOR = "$";
    private static final int KEY_LENGTH_BITS = 256;
    private static final int SALT_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final CredentialPolicyConfig config;
    private final String dummySalt;

    @Inject
    public PasswordHasher(CredentialPolicyConfig config) {
        this.config = config;
        this.dummySalt = generateSalt();
    }

    /**
     * Generate a new random salt.
     *
     * @return 16 random bytes, hex-encoded
     */
    public String generateSalt() {
        final byte[] salt = new byte[SALT_BYTES];
        SECURE_RANDOM.nextBytes(salt);
        return HEX.formatHex(salt);
    }

    /**
     * Hash a password with the configured iteration count.
     *
     * @param password plaintext password
     * @param salt     hex-encoded salt
     * @return serialized hash
     */
    public String hash(String password, String salt) {
        final int iterations = config.hashIterations();
        final byte[] digest = derive(password, salt, iterations);
        return FORMAT_PREFIX + SEPARATOR + iterations + SEPARATOR + HEX.formatHex(digest);
    }

    /**
     * Check a password against a stored hash.
     *
     * @param password   submitted password
     * @param salt       the account's hex-encoded salt
     * @param storedHash serialized hash produced by {@link #hash}
     * @return true if the password matches
     * @throws IllegalStateException if the stored hash is not in a recognized format
     */
    public boolean verify(String password, String salt, String storedHash) {
        final String[] parts = storedHash.split("\\$");
        if (parts.length != 3 || !FORMAT_PREFIX.equals(parts[0])) {
            throw new IllegalStateException("Unrecognized password hash format");
        }

        final int iterations;
        final byte[] expected;
        try {
            iterations = Integer.parseInt(parts[1]);
            expected = HEX.parseHex(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed password hash", e);
        }

        final byte[] candidate = derive(password, salt, iterations);
        return MessageDigest.isEqual(expected, candidate);
    }

    /**
     * Spend the same work as a real verification without checking anything.
     *
     * <p>Used when there is no account to check against, so a rejected login
     * takes as long as a wrong password would.
     *
     * @param password submitted password
     */
    public void dummyVerify(String password) {
        derive(password != null ? password : "", dummySalt, config.hashIterations());
    }

    private byte[] derive(String password, String salt, int iterations) {
        final PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), HEX.parseHex(salt), iterations, KEY_LENGTH_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Password hashing unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
