package aqualog.mock;

import java.security.SecureRandom;
import java.util.Base64;

import aqualog.adapter.out.storage.memory.InMemoryCredentialRepository;
import aqualog.adapter.out.storage.memory.InMemorySessionRepository;
import aqualog.core.config.LockoutConfig;
import aqualog.core.config.SessionConfig;
import aqualog.core.model.auth.Identity;
import aqualog.core.model.auth.Role;
import aqualog.core.service.auth.AccessControlService;
import aqualog.core.service.auth.AuthenticationService;
import aqualog.core.service.auth.CredentialStoreService;
import aqualog.core.service.auth.KeyManager;
import aqualog.core.service.auth.PasswordHashCipher;
import aqualog.core.service.auth.PasswordHasher;
import aqualog.core.service.auth.UserManagementService;
import aqualog.core.service.session.SessionIdGenerator;
import aqualog.core.service.session.SessionService;

/**
 * The whole credential engine wired by hand over in-memory storage, a
 * configured random key and a {@link MutableClock}.
 */
public class CredentialEngineFixture {

    public static final Identity ADMIN = new Identity("admin", Role.ADMIN, "Administrator");

    public final MutableClock clock = MutableClock.startingAt("2026-01-01T09:00:00Z");
    public final RecordingSecurityMonitoring monitoring = new RecordingSecurityMonitoring();
    public final InMemoryCredentialRepository credentialRepository = new InMemoryCredentialRepository();
    public final InMemorySessionRepository sessionRepository = new InMemorySessionRepository();
    public final KeyManager keyManager;
    public final PasswordHasher hasher;
    public final PasswordHashCipher cipher;
    public final CredentialStoreService credentialStore;
    public final SessionService sessionService;
    public final AccessControlService accessControl;
    public final AuthenticationService authentication;
    public final UserManagementService userManagement;

    public CredentialEngineFixture() {
        this(new TestConfigs.TestLockoutConfig(), new TestConfigs.TestSessionConfig());
    }

    public CredentialEngineFixture(LockoutConfig lockoutConfig, SessionConfig sessionConfig) {
        keyManager = new KeyManager(
                new TestConfigs.TestEncryptionConfig(randomKey()), new InMemoryKeyMaterialRepository());
        hasher = new PasswordHasher(new TestConfigs.TestCredentialPolicyConfig());
        cipher = new PasswordHashCipher(keyManager);
        credentialStore = new CredentialStoreService(
                credentialRepository,
                hasher,
                cipher,
                lockoutConfig,
                new TestConfigs.TestCredentialPolicyConfig(),
                monitoring,
                clock);
        sessionService =
                new SessionService(sessionRepository, new SessionIdGenerator(), sessionConfig, monitoring, clock);
        accessControl = new AccessControlService(monitoring);
        authentication = new AuthenticationService(credentialStore, sessionService, monitoring, clock);
        userManagement = new UserManagementService(accessControl, credentialStore, sessionService, monitoring);
    }

    public static String randomKey() {
        final byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    public void createUser(String username, String password, Role role) {
        credentialStore.create(username, password, role, null, null).await().indefinitely();
    }
}
