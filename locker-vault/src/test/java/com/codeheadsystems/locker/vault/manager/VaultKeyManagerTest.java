package com.codeheadsystems.locker.vault.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.codeheadsystems.locker.crypto.codec.SecretCodec;
import com.codeheadsystems.locker.crypto.config.VaultConfig;
import com.codeheadsystems.locker.crypto.exceptions.VaultErrorKind;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import com.codeheadsystems.locker.crypto.model.VaultKey;
import com.codeheadsystems.locker.crypto.model.WrappedVaultKey;
import com.codeheadsystems.locker.vault.store.AccountKeyStore;
import com.codeheadsystems.locker.vault.store.DocumentAccountKeyStore;
import com.codeheadsystems.locker.vault.store.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultKeyManagerTest {

  private static final String ACCOUNT = "alice";
  private static final byte[] SECRET = "Tr0ub4dor&3".getBytes(StandardCharsets.UTF_8);
  private static final byte[] NEW_SECRET = "correct horse battery staple".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG = "tr0ub4dor&3".getBytes(StandardCharsets.UTF_8);
  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

  @Mock private AccountKeyStore mockAccountKeyStore;

  private VaultConfig config;
  private InMemoryDocumentStore documentStore;
  private AccountKeyStore accountKeyStore;
  private VaultKeyManager manager;

  private static void assertUnlockFailed(Runnable runnable) {
    assertThatThrownBy(runnable::run)
        .isInstanceOfSatisfying(VaultException.class, e -> {
          assertThat(e.kind()).isEqualTo(VaultErrorKind.UNLOCK_FAILED);
          assertThat(e).hasMessage(VaultKeyManager.INCORRECT_PASSWORD).hasNoCause();
        });
  }

  @BeforeEach
  void setUp() {
    config = VaultConfig.forTesting();
    documentStore = new InMemoryDocumentStore();
    accountKeyStore = new DocumentAccountKeyStore(documentStore, new ObjectMapper());
    manager = new VaultKeyManager(config, accountKeyStore, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void newManager_isLocked() {
    assertThat(manager.state()).isEqualTo(VaultState.LOCKED);
    assertThat(manager.isUnlocked()).isFalse();
    assertThat(manager.accountId()).isEmpty();
    assertThatThrownBy(manager::currentKey).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void initializeForAccount_persistsAndUnlocks() {
    VaultKey key = manager.initializeForAccount(ACCOUNT, SECRET);

    assertThat(manager.isUnlocked()).isTrue();
    assertThat(manager.currentKey()).isSameAs(key);
    assertThat(manager.accountId()).contains(ACCOUNT);
    assertThat(manager.hasVaultKey(ACCOUNT)).isTrue();
    assertThat(manager.hasVaultKey("bob")).isFalse();

    WrappedVaultKey wrapped = accountKeyStore.load(ACCOUNT).orElseThrow();
    assertThat(wrapped.salt()).hasSize(VaultConfig.SALT_LENGTH);
    assertThat(wrapped.vaultKeyIv()).hasSize(16);
    assertThat(wrapped.encryptedVaultKey()).hasSize(48);
    assertThat(wrapped.iterations()).isEqualTo(1_000);
    assertThat(wrapped.createdAt()).isEqualTo(NOW);
  }

  @Test
  void initializeForAccount_twice_throws() {
    manager.initializeForAccount(ACCOUNT, SECRET);
    WrappedVaultKey original = accountKeyStore.load(ACCOUNT).orElseThrow();

    assertThatThrownBy(() -> manager.initializeForAccount(ACCOUNT, NEW_SECRET))
        .isInstanceOf(IllegalStateException.class);
    assertThat(accountKeyStore.load(ACCOUNT).orElseThrow().encryptedVaultKey())
        .isEqualTo(original.encryptedVaultKey());
  }

  @Test
  void initializeForAccount_concurrentlyInitialized_throwsAndStaysLocked() {
    VaultKeyManager mocked = new VaultKeyManager(config, mockAccountKeyStore);
    when(mockAccountKeyStore.load(ACCOUNT)).thenReturn(Optional.empty());
    when(mockAccountKeyStore.storeIfAbsent(eq(ACCOUNT), any(WrappedVaultKey.class))).thenReturn(false);

    assertThatThrownBy(() -> mocked.initializeForAccount(ACCOUNT, SECRET))
        .isInstanceOf(IllegalStateException.class);
    assertThat(mocked.isUnlocked()).isFalse();
    assertThat(mocked.accountId()).isEmpty();
  }

  @Test
  void unlock_afterLock_recoversSameKey() {
    byte[] original = manager.initializeForAccount(ACCOUNT, SECRET).bytes();
    manager.lock();
    assertThat(manager.state()).isEqualTo(VaultState.LOCKED);

    VaultKey unlocked = manager.unlock(ACCOUNT, SECRET);

    assertThat(unlocked.matches(original)).isTrue();
    assertThat(manager.state()).isEqualTo(VaultState.UNLOCKED);
    assertThat(manager.accountId()).contains(ACCOUNT);
  }

  @Test
  void unlock_wrongSecret_failsAndStaysLocked() {
    VaultKey key = manager.initializeForAccount(ACCOUNT, SECRET);

    assertUnlockFailed(() -> manager.unlock(ACCOUNT, WRONG));

    assertThat(manager.state()).isEqualTo(VaultState.LOCKED);
    assertThat(key.isDestroyed()).isTrue();
  }

  @Test
  void unlock_missingAccount_failsWithSameMessage() {
    assertUnlockFailed(() -> manager.unlock("bob", SECRET));
  }

  @Test
  void unlock_wrappedRecord_hasNoAccount() {
    manager.initializeForAccount(ACCOUNT, SECRET);
    WrappedVaultKey wrapped = accountKeyStore.load(ACCOUNT).orElseThrow();
    manager.lock();

    manager.unlock(SECRET, wrapped);

    assertThat(manager.isUnlocked()).isTrue();
    assertThat(manager.accountId()).isEmpty();
  }

  @Test
  void unlock_usesIterationsStoredWithRecord() {
    VaultKeyManager stronger = new VaultKeyManager(config.withIterations(2_000), accountKeyStore);
    byte[] original = stronger.initializeForAccount(ACCOUNT, SECRET).bytes();

    assertThat(manager.unlock(ACCOUNT, SECRET).matches(original)).isTrue();
  }

  @Test
  void unlock_damagedRecord_failsWithSameMessage() {
    manager.initializeForAccount(ACCOUNT, SECRET);
    WrappedVaultKey wrapped = accountKeyStore.load(ACCOUNT).orElseThrow();
    WrappedVaultKey damaged = new WrappedVaultKey(wrapped.salt(), wrapped.vaultKeyIv(),
        Arrays.copyOf(wrapped.encryptedVaultKey(), 47), wrapped.iterations(),
        wrapped.createdAt(), wrapped.updatedAt());
    VaultKeyManager mocked = new VaultKeyManager(config, mockAccountKeyStore);
    when(mockAccountKeyStore.load(ACCOUNT)).thenReturn(Optional.of(damaged));

    assertUnlockFailed(() -> mocked.unlock(ACCOUNT, SECRET));
    assertThat(mocked.isUnlocked()).isFalse();
  }

  @Test
  void unlock_unreadableStoredDocument_failsWithSameMessageAndLocks() {
    VaultKey bobKey = manager.initializeForAccount("bob", SECRET);
    documentStore.put("users/alice", "not json");

    assertUnlockFailed(() -> manager.unlock(ACCOUNT, SECRET));
    assertThat(manager.state()).isEqualTo(VaultState.LOCKED);
    assertThat(bobKey.isDestroyed()).isTrue();

    documentStore.put("users/alice", "{\"salt\":\"%%%\",\"vaultKeyIV\":\"AAAA\",\"encryptedVaultKey\":\"AAAA\"}");
    assertUnlockFailed(() -> manager.unlock(ACCOUNT, SECRET));
  }

  @Test
  void unlock_badIvLength_failsWithSameMessage() {
    manager.initializeForAccount(ACCOUNT, SECRET);
    WrappedVaultKey wrapped = accountKeyStore.load(ACCOUNT).orElseThrow();
    WrappedVaultKey damaged = new WrappedVaultKey(wrapped.salt(), new byte[8],
        wrapped.encryptedVaultKey(), wrapped.iterations(), wrapped.createdAt(), wrapped.updatedAt());

    assertUnlockFailed(() -> manager.unlock(SECRET, damaged));
  }

  @Test
  void lock_destroysKeyAndIsIdempotent() {
    VaultKey key = manager.initializeForAccount(ACCOUNT, SECRET);

    manager.lock();
    manager.lock();

    assertThat(key.isDestroyed()).isTrue();
    assertThat(manager.accountId()).isEmpty();
  }

  @Test
  void changeSecret_rewrapsWithoutTouchingSecrets() {
    VaultKey key = manager.initializeForAccount(ACCOUNT, SECRET);
    byte[] original = key.bytes();
    SecretCodec codec = new SecretCodec(config);
    String blob = codec.encodeCurrent("hunter2", key);
    WrappedVaultKey before = accountKeyStore.load(ACCOUNT).orElseThrow();

    manager.changeSecret(ACCOUNT, SECRET, NEW_SECRET);

    WrappedVaultKey after = accountKeyStore.load(ACCOUNT).orElseThrow();
    assertThat(after.salt()).isEqualTo(before.salt());
    assertThat(after.vaultKeyIv()).isNotEqualTo(before.vaultKeyIv());
    assertThat(after.createdAt()).isEqualTo(before.createdAt());
    assertThat(manager.isUnlocked()).isTrue();

    manager.lock();
    assertUnlockFailed(() -> manager.unlock(ACCOUNT, SECRET));
    VaultKey reopened = manager.unlock(ACCOUNT, NEW_SECRET);
    assertThat(reopened.matches(original)).isTrue();
    assertThat(codec.decodeCurrent(blob, reopened)).isEqualTo("hunter2");
  }

  @Test
  void changeSecret_wrongOldSecret_leavesRecordUnchanged() {
    manager.initializeForAccount(ACCOUNT, SECRET);
    WrappedVaultKey before = accountKeyStore.load(ACCOUNT).orElseThrow();

    assertUnlockFailed(() -> manager.changeSecret(ACCOUNT, WRONG, NEW_SECRET));

    WrappedVaultKey after = accountKeyStore.load(ACCOUNT).orElseThrow();
    assertThat(after.encryptedVaultKey()).isEqualTo(before.encryptedVaultKey());
    assertThat(manager.unlock(ACCOUNT, SECRET)).isNotNull();
  }
}
