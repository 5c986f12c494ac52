package aqualog.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import aqualog.core.service.auth.PasswordHashCipher.CipherException;
import aqualog.mock.CredentialEngineFixture;
import aqualog.mock.InMemoryKeyMaterialRepository;
import aqualog.mock.TestConfigs.TestEncryptionConfig;

@DisplayName("PasswordHashCipher")
class PasswordHashCipherTest {

    private static final String HASH = "pbkdf2-sha256$1000$00112233445566778899aabbccddeeff";

    private PasswordHashCipher cipher;

    @BeforeEach
    void setUp() {
        cipher = cipherWithKey(CredentialEngineFixture.randomKey());
    }

    private static PasswordHashCipher cipherWithKey(String key) {
        return new PasswordHashCipher(
                new KeyManager(new TestEncryptionConfig(key), new InMemoryKeyMaterialRepository()));
    }

    @Test
    @DisplayName("should decrypt what it encrypted")
    void shouldDecryptEncrypted() {
        final var encrypted = cipher.encrypt(HASH);

        assertEquals(HASH, cipher.decrypt(encrypted));
    }

    @Test
    @DisplayName("should not expose the plaintext hash")
    void shouldNotExposePlaintext() {
        final var encrypted = cipher.encrypt(HASH);

        assertFalse(encrypted.contains("pbkdf2"));
        assertFalse(new String(Base64.getDecoder().decode(encrypted)).contains("pbkdf2"));
    }

    @Test
    @DisplayName("should use a fresh IV for every encryption")
    void shouldUseFreshIv() {
        assertNotEquals(cipher.encrypt(HASH), cipher.encrypt(HASH));
    }

    @Test
    @DisplayName("should fail to decrypt data encrypted under another key")
    void shouldFailWithOtherKey() {
        final var encrypted = cipherWithKey(CredentialEngineFixture.randomKey()).encrypt(HASH);

        assertThrows(CipherException.class, () -> cipher.decrypt(encrypted));
    }

    @Test
    @DisplayName("should fail on tampered ciphertext")
    void shouldFailOnTampering() {
        final byte[] payload = Base64.getDecoder().decode(cipher.encrypt(HASH));
        payload[payload.length - 1] ^= 0x01;

        assertThrows(CipherException.class, () -> cipher.decrypt(Base64.getEncoder().encodeToString(payload)));
    }

    @Test
    @DisplayName("should fail on malformed input")
    void shouldFailOnMalformedInput() {
        assertThrows(CipherException.class, () -> cipher.decrypt("%%%"));
        assertThrows(CipherException.class, () -> cipher.decrypt(""));
    }
}
